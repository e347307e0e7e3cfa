package com.flagship.budget_engine;

import com.flagship.budget_engine.budget.Budget;
import com.flagship.budget_engine.budget.BudgetProgressCalculator;
import com.flagship.budget_engine.budget.BudgetSummary;
import com.flagship.budget_engine.common.DateRange;
import com.flagship.budget_engine.exception.BudgetEngineException;
import com.flagship.budget_engine.exception.PersistenceException;
import com.flagship.budget_engine.period.BudgetPeriod;
import com.flagship.budget_engine.period.BudgetPeriodManager;
import com.flagship.budget_engine.period.BudgetPeriodService;
import com.flagship.budget_engine.period.PeriodClosure;
import com.flagship.budget_engine.port.BudgetDataPort;
import com.flagship.budget_engine.port.GuardedDataPort;
import com.flagship.budget_engine.recurring.ExecutionOptions;
import com.flagship.budget_engine.recurring.ExecutionResult;
import com.flagship.budget_engine.recurring.MissedExecution;
import com.flagship.budget_engine.recurring.ReconciliationReport;
import com.flagship.budget_engine.recurring.RecurringExecutionService;
import com.flagship.budget_engine.recurring.SeriesReconciliationService;
import com.flagship.budget_engine.transaction.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Facade exposed to the host application (web layer, jobs, CLI).
 *
 * Error policy:
 * - Period operations report domain failures (conflict, not found, invalid range) in the
 *   returned {@link PeriodResult}
 * - {@link PersistenceException} always propagates: the host's storage is unreachable
 * - Recurring and reconciliation operations throw, as their services do
 */
@Service
@Slf4j
public class BudgetEngine {

    private final BudgetPeriodService periodService;
    private final BudgetPeriodManager periodManager;
    private final RecurringExecutionService executionService;
    private final SeriesReconciliationService reconciliationService;
    private final BudgetProgressCalculator progressCalculator;
    private final BudgetDataPort dataPort;

    public BudgetEngine(BudgetPeriodService periodService,
                        BudgetPeriodManager periodManager,
                        RecurringExecutionService executionService,
                        SeriesReconciliationService reconciliationService,
                        BudgetProgressCalculator progressCalculator,
                        BudgetDataPort dataPort) {
        this.periodService = periodService;
        this.periodManager = periodManager;
        this.executionService = executionService;
        this.reconciliationService = reconciliationService;
        this.progressCalculator = progressCalculator;
        this.dataPort = GuardedDataPort.wrap(dataPort);
    }

    public PeriodResult closePeriod(String userId, LocalDate endDate) {
        try {
            PeriodClosure closure = periodService.closePeriod(userId, endDate);
            return PeriodResult.closed(closure.getClosedPeriod(), closure.getNextPeriod(), closure.getNextPeriodError());
        } catch (PersistenceException e) {
            throw e;
        } catch (BudgetEngineException e) {
            log.info("Close period rejected: userId={}, endDate={}, errorCode={}, error={}",
                    userId, endDate, e.getErrorCode(), e.getMessage());
            return PeriodResult.failure(e);
        }
    }

    public PeriodResult startPeriod(String userId, LocalDate startDate) {
        try {
            return PeriodResult.of(periodService.startPeriod(userId, startDate));
        } catch (PersistenceException e) {
            throw e;
        } catch (BudgetEngineException e) {
            log.info("Start period rejected: userId={}, startDate={}, errorCode={}, error={}",
                    userId, startDate, e.getErrorCode(), e.getMessage());
            return PeriodResult.failure(e);
        }
    }

    public List<BudgetPeriod> getPeriods(String userId) {
        return periodService.getPeriods(userId);
    }

    public ExecutionResult runDueRecurring() {
        return runDueRecurring(ExecutionOptions.defaults());
    }

    public ExecutionResult runDueRecurring(ExecutionOptions options) {
        return executionService.runDueRecurring(options);
    }

    public ReconciliationReport getReconciliation(UUID seriesId) {
        return reconciliationService.getSeriesReconciliation(seriesId);
    }

    public List<MissedExecution> findMissedExecutions() {
        return reconciliationService.findMissedExecutions();
    }

    /**
     * Budget progress over the user's active period; zero spend when no period is active.
     */
    public BudgetSummary getBudgetSummary(String userId) {
        Optional<BudgetPeriod> active = periodService.getActivePeriod(userId);
        DateRange window = active.map(periodManager::window).orElse(null);

        List<Budget> budgets = dataPort.loadBudgetsByUser(userId);
        List<Transaction> transactions = window != null
            ? dataPort.loadTransactionsByUser(userId, window)
            : List.of();

        return progressCalculator.summarize(userId, budgets, transactions, window);
    }
}
