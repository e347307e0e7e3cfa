package com.flagship.budget_engine.recurring;

import com.flagship.budget_engine.transaction.Transaction;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a recurring batch.
 *
 * {@code executed} holds the transactions created by the data port; it stays empty for a
 * dry run.
 */
@Value
public class ExecutionResult {
    String runId;
    boolean dryRun;
    List<Transaction> executed;
    List<ExecutionFailure> failed;
    ExecutionSummary summary;
}
