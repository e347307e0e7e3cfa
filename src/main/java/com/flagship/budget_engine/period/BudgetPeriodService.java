package com.flagship.budget_engine.period;

import com.flagship.budget_engine.budget.Budget;
import com.flagship.budget_engine.common.DateRange;
import com.flagship.budget_engine.exception.BudgetEngineException;
import com.flagship.budget_engine.exception.NotFoundException;
import com.flagship.budget_engine.observability.CorrelationContext;
import com.flagship.budget_engine.observability.EngineMetrics;
import com.flagship.budget_engine.port.BudgetDataPort;
import com.flagship.budget_engine.port.GuardedDataPort;
import com.flagship.budget_engine.transaction.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Service for starting and closing budget periods against the host's data port.
 *
 * Closing and starting the next period form one logical operation:
 * 1. Close the active period and persist its totals
 * 2. Start the next period the day after the closing date
 *
 * Step 2 is not transactional with step 1. If it fails the close stands, the failure is
 * logged and counted, and the user has no active period until a start is retried.
 *
 * Callers must serialize closePeriod per user.
 */
@Service
@Slf4j
public class BudgetPeriodService {

    private final BudgetDataPort dataPort;
    private final BudgetPeriodManager periodManager;
    private final EngineMetrics metrics;
    private final Clock clock;

    public BudgetPeriodService(BudgetDataPort dataPort, BudgetPeriodManager periodManager,
                               EngineMetrics metrics, Clock clock) {
        this.dataPort = GuardedDataPort.wrap(dataPort);
        this.periodManager = periodManager;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Starts a new budget period for a user.
     *
     * @return the persisted period
     * @throws com.flagship.budget_engine.exception.ConflictException if an active period exists
     * @throws com.flagship.budget_engine.exception.InvalidRangeException if the start date
     *         precedes the previous period's end date
     */
    public BudgetPeriod startPeriod(String userId, LocalDate startDate) {
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, userId);
        try {
            List<BudgetPeriod> periods = dataPort.loadPeriodsByUser(userId);
            BudgetPeriod period = periodManager.startPeriod(userId, startDate, periods, clock.instant());

            BudgetPeriod saved = dataPort.createPeriod(period);
            BudgetPeriod result = saved != null ? saved : period;

            metrics.incrementPeriodsStarted();
            log.info("Budget period started: periodId={}, startDate={}", result.getId(), result.getStartDate());
            return result;
        } finally {
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
        }
    }

    /**
     * Closes the user's active period on {@code endDate} and chains the next one.
     *
     * A repeated call with the same end date returns the already closed period without
     * re-aggregating, unless an active period starting on or before {@code endDate} exists.
     *
     * @throws NotFoundException if the user has no active period and no period closed on {@code endDate}
     * @throws com.flagship.budget_engine.exception.InvalidRangeException if {@code endDate}
     *         is before the active period's start date
     */
    public PeriodClosure closePeriod(String userId, LocalDate endDate) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }
        if (endDate == null) {
            throw new IllegalArgumentException("End date is required");
        }

        MDC.put(CorrelationContext.USER_ID_MDC_KEY, userId);
        try {
            List<BudgetPeriod> periods = dataPort.loadPeriodsByUser(userId);

            Optional<BudgetPeriod> current = periodManager.findActive(periods);

            // An active period covering endDate is closed even if an older period ended on the same day
            if (current.isEmpty() || current.get().getStartDate().isAfter(endDate)) {
                Optional<BudgetPeriod> alreadyClosed = periodManager.findClosedOn(periods, endDate);
                if (alreadyClosed.isPresent()) {
                    log.info("Budget period already closed on {}: periodId={}", endDate, alreadyClosed.get().getId());
                    return PeriodClosure.unchanged(alreadyClosed.get());
                }
            }

            BudgetPeriod active = current
                .orElseThrow(() -> new NotFoundException("No active budget period for user " + userId));
            MDC.put(CorrelationContext.PERIOD_ID_MDC_KEY, active.getId().toString());

            DateRange window = periodManager.closingWindow(active, endDate);
            List<Transaction> transactions = dataPort.loadTransactionsByUser(userId, window);
            List<Budget> budgets = dataPort.loadBudgetsByUser(userId);

            BudgetPeriod closed = periodManager.closePeriod(active, endDate, transactions, budgets, clock.instant());
            dataPort.updatePeriod(closed.getId(), PeriodUpdate.closing(closed));
            metrics.incrementPeriodsClosed();

            log.info("Budget period closed: endDate={}, totalSpent={}, totalSaved={}, budgets={}, transactions={}",
                    closed.getEndDate(), closed.getTotalSpent(), closed.getTotalSaved(),
                    budgets.size(), transactions.size());

            return chainNextPeriod(userId, closed);
        } finally {
            MDC.remove(CorrelationContext.PERIOD_ID_MDC_KEY);
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
        }
    }

    /**
     * All periods of a user, newest first.
     */
    public List<BudgetPeriod> getPeriods(String userId) {
        return dataPort.loadPeriodsByUser(userId).stream()
            .sorted(Comparator.comparing(BudgetPeriod::getStartDate, Comparator.nullsLast(Comparator.reverseOrder())))
            .toList();
    }

    public Optional<BudgetPeriod> getActivePeriod(String userId) {
        return periodManager.findActive(dataPort.loadPeriodsByUser(userId));
    }

    /**
     * Lifecycle state of the user: ACTIVE with an open period, CLOSED when only closed
     * periods exist, NO_PERIOD otherwise.
     */
    public PeriodState getState(String userId) {
        List<BudgetPeriod> periods = dataPort.loadPeriodsByUser(userId);
        if (periodManager.findActive(periods).isPresent()) {
            return PeriodState.ACTIVE;
        }
        return periods.isEmpty() ? PeriodState.NO_PERIOD : PeriodState.CLOSED;
    }

    private PeriodClosure chainNextPeriod(String userId, BudgetPeriod closed) {
        LocalDate nextStart = closed.getEndDate().plusDays(1);
        try {
            BudgetPeriod next = startPeriod(userId, nextStart);
            return PeriodClosure.chained(closed, next);
        } catch (BudgetEngineException e) {
            metrics.incrementChainFailures();
            log.warn("Failed to auto-create next budget period: nextStart={}, errorCode={}, error={}",
                    nextStart, e.getErrorCode(), e.getMessage());
            return PeriodClosure.chainFailed(closed, e.getMessage());
        }
    }
}
