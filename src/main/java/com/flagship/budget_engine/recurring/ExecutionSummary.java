package com.flagship.budget_engine.recurring;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Counters of a batch. {@code totalAmount} includes dry-run successes.
 */
@Value
public class ExecutionSummary {
    int totalProcessed;
    int successfulExecutions;
    int failedExecutions;
    BigDecimal totalAmount;
}
