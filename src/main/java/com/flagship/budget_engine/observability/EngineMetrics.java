package com.flagship.budget_engine.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Centralized metrics for period and recurring operations.
 *
 * Metrics exposed:
 * - recurring.executions: Counter of series executions, tagged by status
 *   (success, dry_run, failed, inactive)
 * - recurring.execution.amount: Summary of executed amounts
 * - recurring.batch.duration: Timer for runDue batches
 * - recurring.reconciliation.missed: Counter of missed payments found by audits
 * - budget.periods.started / budget.periods.closed: Period lifecycle counters
 * - budget.periods.chain.failures: Chained period starts that failed after a close
 */
@Component
public class EngineMetrics {

    private final MeterRegistry registry;

    private final Counter periodsStarted;
    private final Counter periodsClosed;
    private final Counter chainFailures;
    private final DistributionSummary executionAmount;
    private final Timer batchTimer;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.periodsStarted = Counter.builder("budget.periods.started")
                .description("Number of budget periods started")
                .register(registry);

        this.periodsClosed = Counter.builder("budget.periods.closed")
                .description("Number of budget periods closed")
                .register(registry);

        this.chainFailures = Counter.builder("budget.periods.chain.failures")
                .description("Number of closes whose chained period start failed")
                .register(registry);

        this.executionAmount = DistributionSummary.builder("recurring.execution.amount")
                .description("Amount of executed recurring transactions")
                .register(registry);

        this.batchTimer = Timer.builder("recurring.batch.duration")
                .description("Time taken to run a batch of due series")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Period Metrics ====================

    public void incrementPeriodsStarted() {
        periodsStarted.increment();
    }

    public void incrementPeriodsClosed() {
        periodsClosed.increment();
    }

    public void incrementChainFailures() {
        chainFailures.increment();
    }

    // ==================== Recurring Metrics ====================

    /**
     * Records one series execution outcome.
     * Uses registry.counter() for efficient meter lookup/creation.
     */
    public void recordExecution(String status) {
        registry.counter("recurring.executions",
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordExecutedAmount(BigDecimal amount) {
        if (amount != null) {
            executionAmount.record(amount.doubleValue());
        }
    }

    public void recordBatchDuration(Duration duration) {
        batchTimer.record(duration);
    }

    public void recordMissedPayments(int missed) {
        if (missed > 0) {
            registry.counter("recurring.reconciliation.missed").increment(missed);
        }
    }

    // ==================== Helper Methods ====================

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
