package com.flagship.budget_engine.recurring;

import com.flagship.budget_engine.common.Money;
import com.flagship.budget_engine.exception.NotFoundException;
import com.flagship.budget_engine.observability.EngineMetrics;
import com.flagship.budget_engine.port.BudgetDataPort;
import com.flagship.budget_engine.port.GuardedDataPort;
import com.flagship.budget_engine.transaction.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Detects drift between a series' execution counter and its persisted transactions.
 *
 * Used for audits and health checks, not on the execution hot path. Results are always
 * derived from the transaction log; the counter alone is never trusted.
 */
@Service
@Slf4j
public class SeriesReconciliationService {

    private final BudgetDataPort dataPort;
    private final EngineMetrics metrics;

    public SeriesReconciliationService(BudgetDataPort dataPort, EngineMetrics metrics) {
        this.dataPort = GuardedDataPort.wrap(dataPort);
        this.metrics = metrics;
    }

    /**
     * Transactions produced by a series.
     */
    public List<Transaction> getTransactionsBySeries(UUID seriesId) {
        if (seriesId == null) {
            throw new IllegalArgumentException("Series ID is required");
        }
        return dataPort.loadTransactionsBySeries(seriesId).stream()
            .filter(transaction -> transaction.isLinkedTo(seriesId))
            .toList();
    }

    /**
     * Reconciles one series.
     *
     * @throws NotFoundException if the series does not exist
     */
    public ReconciliationReport getSeriesReconciliation(UUID seriesId) {
        if (seriesId == null) {
            throw new IllegalArgumentException("Series ID is required");
        }
        RecurringTransactionSeries series = dataPort.loadSeries(seriesId)
            .orElseThrow(() -> new NotFoundException("Recurring series not found: " + seriesId));
        return reconcile(series, getTransactionsBySeries(seriesId));
    }

    /**
     * Reconciles a series against an already loaded transaction log.
     */
    public ReconciliationReport reconcile(RecurringTransactionSeries series, List<Transaction> transactions) {
        int expected = series.getTotalExecutions();
        int actual = transactions.size();

        BigDecimal expectedTotal = Money.round(Money.orZero(series.getAmount()).multiply(BigDecimal.valueOf(expected)));
        BigDecimal actualTotal = Money.round(Money.sum(transactions.stream().map(Transaction::getAmount).toList()));
        BigDecimal successRate = expected > 0
            ? Money.percentage(BigDecimal.valueOf(actual), BigDecimal.valueOf(expected))
            : Money.ZERO;

        return new ReconciliationReport(
            series,
            List.copyOf(transactions),
            expected,
            actual,
            expected - actual,
            expectedTotal,
            actualTotal,
            actualTotal.subtract(expectedTotal),
            successRate
        );
    }

    /**
     * Active series whose counter is ahead of their persisted transactions.
     */
    public List<MissedExecution> findMissedExecutions() {
        List<MissedExecution> missed = new ArrayList<>();
        for (RecurringTransactionSeries series : dataPort.loadActiveSeries()) {
            ReconciliationReport report = reconcile(series, getTransactionsBySeries(series.getId()));
            if (report.getMissedPayments() > 0) {
                log.warn("Series has missed payments: seriesId={}, missed={}, expected={}, actual={}",
                        series.getId(), report.getMissedPayments(),
                        report.getExpectedExecutions(), report.getActualExecutions());
                metrics.recordMissedPayments(report.getMissedPayments());
                missed.add(new MissedExecution(series, report.getMissedPayments()));
            }
        }
        log.info("Missed execution audit finished: seriesWithMissedPayments={}", missed.size());
        return missed;
    }
}
