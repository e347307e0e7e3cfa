package com.flagship.budget_engine.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Transaction-creation command handed to the data port.
 *
 * Transactions materialized from a recurring series always carry
 * {@code recurringSeriesId}: it is the only link reconciliation uses.
 */
@Value
@Builder
public class NewTransaction {
    String userId;
    String accountId;
    String toAccountId;
    String groupId;
    TransactionType type;
    BigDecimal amount;
    String category;
    String description;
    Instant date;
    UUID recurringSeriesId;
}
