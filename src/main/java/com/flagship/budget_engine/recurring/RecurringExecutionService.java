package com.flagship.budget_engine.recurring;

import com.flagship.budget_engine.common.Money;
import com.flagship.budget_engine.config.BudgetEngineProperties;
import com.flagship.budget_engine.observability.CorrelationContext;
import com.flagship.budget_engine.observability.EngineMetrics;
import com.flagship.budget_engine.port.BudgetDataPort;
import com.flagship.budget_engine.port.GuardedDataPort;
import com.flagship.budget_engine.transaction.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Executes recurring transaction series that are due.
 *
 * For each due series this service:
 * 1. Rejects inactive or paused series (reported as a failure, the batch continues)
 * 2. Computes the next due date (an unsupported frequency fails before anything is written)
 * 3. Creates the transaction, tagged with the series ID, dated "now"
 * 4. Advances the series: totalExecutions + 1, dueDate = next, transaction ID appended
 *
 * Failure handling:
 * - Every series is isolated: an exception is recorded in the result and the next
 *   series runs
 * - Series overdue beyond maxDaysOverdue are skipped, not failed, so a long outage does
 *   not trigger a runaway backfill
 * - Series with auto-execution off are skipped unless the batch is forced
 * - Failing to load the series aborts the whole batch with a PersistenceException
 *
 * A dry run computes the same result without any data port write.
 */
@Service
@Slf4j
public class RecurringExecutionService {

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final BudgetDataPort dataPort;
    private final DueDateCalculator dueDateCalculator;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final ZoneId zone;
    private final int defaultMaxDaysOverdue;

    public RecurringExecutionService(BudgetDataPort dataPort, DueDateCalculator dueDateCalculator,
                                     EngineMetrics metrics, Clock clock, BudgetEngineProperties properties) {
        this.dataPort = GuardedDataPort.wrap(dataPort);
        this.dueDateCalculator = dueDateCalculator;
        this.metrics = metrics;
        this.clock = clock;
        this.zone = properties.zoneId();
        this.defaultMaxDaysOverdue = properties.getRecurring().getMaxDaysOverdue();
    }

    /**
     * Loads the active series from the data port and executes the due ones.
     *
     * @throws com.flagship.budget_engine.exception.PersistenceException if the series cannot be loaded
     */
    public ExecutionResult runDueRecurring(ExecutionOptions options) {
        List<RecurringTransactionSeries> activeSeries = dataPort.loadActiveSeries();
        return runDue(activeSeries, clock.instant(), options);
    }

    /**
     * Executes the series of {@code candidates} that are due at {@code now}.
     *
     * Never throws for a single series failure.
     */
    public ExecutionResult runDue(Collection<RecurringTransactionSeries> candidates, Instant now,
                                  ExecutionOptions options) {
        ExecutionOptions effective = options != null ? options : ExecutionOptions.defaults();
        int maxDaysOverdue = resolveMaxDaysOverdue(effective);
        boolean dryRun = effective.isDryRun();
        boolean forceExecute = effective.isForceExecute();

        String runId = CorrelationContext.generateRunId();
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.RUN_ID_MDC_KEY, runId);

        try {
            List<RecurringTransactionSeries> due = new ArrayList<>();
            for (RecurringTransactionSeries series : candidates) {
                if (!isDue(series, now, maxDaysOverdue)) {
                    log.debug("Series not due: seriesId={}, dueDate={}", series.getId(), series.getDueDate());
                } else if (!forceExecute && !series.isAutoExecute()) {
                    log.debug("Series due but not auto-executed: seriesId={}", series.getId());
                } else {
                    due.add(series);
                }
            }

            log.info("Running recurring batch: candidates={}, due={}, dryRun={}, forceExecute={}, maxDaysOverdue={}",
                    candidates.size(), due.size(), dryRun, forceExecute, maxDaysOverdue);

            List<Transaction> executed = new ArrayList<>();
            List<ExecutionFailure> failed = new ArrayList<>();
            int successful = 0;
            BigDecimal totalAmount = BigDecimal.ZERO;

            for (RecurringTransactionSeries series : due) {
                MDC.put(CorrelationContext.SERIES_ID_MDC_KEY, String.valueOf(series.getId()));
                try {
                    String rejection = rejectionOf(series);
                    if (rejection != null) {
                        log.warn("Skipping {} series: description={}", rejection, series.getDescription());
                        failed.add(new ExecutionFailure(series.getId(), series.getDescription(), rejection));
                        metrics.recordExecution(rejection);
                        continue;
                    }

                    if (dryRun) {
                        LocalDate nextDue = dueDateCalculator.nextDue(series.getDueDate(), series.getFrequency());
                        log.info("[DRY RUN] Would execute series: description={}, amount={}, nextDue={}",
                                series.getDescription(), series.getAmount(), nextDue);
                        metrics.recordExecution("dry_run");
                    } else {
                        executed.add(execute(series, now));
                        metrics.recordExecution("success");
                        metrics.recordExecutedAmount(series.getAmount());
                    }
                    successful++;
                    totalAmount = totalAmount.add(Money.orZero(series.getAmount()));

                } catch (Exception e) {
                    log.error("Recurring series execution failed: description={}, error={}",
                            series.getDescription(), e.getMessage());
                    failed.add(new ExecutionFailure(series.getId(), series.getDescription(), describe(e)));
                    metrics.recordExecution("failed");
                    if (!dryRun) {
                        recordFailedExecution(series);
                    }
                } finally {
                    MDC.remove(CorrelationContext.SERIES_ID_MDC_KEY);
                }
            }

            ExecutionSummary summary = new ExecutionSummary(
                due.size(), successful, failed.size(), Money.round(totalAmount));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordBatchDuration(Duration.ofMillis(duration));
            log.info("Recurring batch finished: processed={}, successful={}, failed={}, totalAmount={}, duration={}ms",
                    summary.getTotalProcessed(), summary.getSuccessfulExecutions(),
                    summary.getFailedExecutions(), summary.getTotalAmount(), duration);

            return new ExecutionResult(runId, dryRun, List.copyOf(executed), List.copyOf(failed), summary);
        } finally {
            MDC.remove(CorrelationContext.RUN_ID_MDC_KEY);
        }
    }

    /**
     * A series is due when it falls due today or is overdue by at most {@code maxDaysOverdue} days.
     */
    public boolean isDue(RecurringTransactionSeries series, Instant now, int maxDaysOverdue) {
        if (series.getDueDate() == null) {
            return false;
        }
        long days = daysUntilDue(series.getDueDate(), now);
        return days <= 0 && days >= -maxDaysOverdue;
    }

    /**
     * {@code ceil((dueDate at start of day - now) / 1 day)}; negative when overdue.
     */
    public long daysUntilDue(LocalDate dueDate, Instant now) {
        long millis = Duration.between(now, dueDate.atStartOfDay(zone).toInstant()).toMillis();
        return (long) Math.ceil((double) millis / MILLIS_PER_DAY);
    }

    private Transaction execute(RecurringTransactionSeries series, Instant now) {
        LocalDate nextDue = dueDateCalculator.nextDue(series.getDueDate(), series.getFrequency());

        Transaction transaction = dataPort.createTransaction(series.toTransaction(now));
        if (transaction == null || transaction.getId() == null) {
            throw new IllegalStateException("Data port returned no transaction ID for series " + series.getId());
        }

        dataPort.updateSeries(series.getId(), SeriesUpdate.afterExecution(series, nextDue, transaction.getId(), now));

        log.info("Series executed: transactionId={}, amount={}, nextDue={}",
                transaction.getId(), series.getAmount(), nextDue);
        return transaction;
    }

    /**
     * Reason a due series must not run, or null when it may.
     */
    private static String rejectionOf(RecurringTransactionSeries series) {
        if (!series.isActive()) {
            return ExecutionFailure.INACTIVE;
        }
        if (series.isPaused()) {
            return ExecutionFailure.PAUSED;
        }
        return null;
    }

    /**
     * Best effort: the batch result already reports the failure.
     */
    private void recordFailedExecution(RecurringTransactionSeries series) {
        try {
            dataPort.updateSeries(series.getId(), SeriesUpdate.afterFailure(series));
        } catch (RuntimeException updateError) {
            log.warn("Failed to update failedExecutions for series {}: {}", series.getId(), updateError.getMessage());
        }
    }

    private int resolveMaxDaysOverdue(ExecutionOptions options) {
        int maxDaysOverdue = options.getMaxDaysOverdue() != null ? options.getMaxDaysOverdue() : defaultMaxDaysOverdue;
        if (maxDaysOverdue < 0) {
            throw new IllegalArgumentException("maxDaysOverdue must not be negative");
        }
        return maxDaysOverdue;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
