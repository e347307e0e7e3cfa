package com.flagship.budget_engine.recurring;

import lombok.Builder;
import lombok.Value;

/**
 * Options of a recurring batch.
 *
 * {@code maxDaysOverdue} left null falls back to {@code budget-engine.recurring.max-days-overdue}.
 */
@Value
@Builder
public class ExecutionOptions {

    /**
     * Simulates the batch: counters only, no data port writes.
     */
    boolean dryRun;

    /**
     * Also runs due series whose auto-execution is off.
     */
    boolean forceExecute;

    Integer maxDaysOverdue;

    public static ExecutionOptions defaults() {
        return ExecutionOptions.builder().build();
    }

    public static ExecutionOptions dryRun() {
        return ExecutionOptions.builder().dryRun(true).build();
    }
}
