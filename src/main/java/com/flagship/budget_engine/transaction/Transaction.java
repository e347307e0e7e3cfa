package com.flagship.budget_engine.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a persisted transaction, as handed to the engine by the data port.
 *
 * {@code amount} is always a non-negative magnitude; the sign comes from {@link #type}.
 */
@Value
@Builder(toBuilder = true)
public class Transaction {
    UUID id;
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

    public boolean hasCounterpartAccount() {
        return toAccountId != null && !toAccountId.isBlank();
    }

    public boolean isLinkedTo(UUID seriesId) {
        return seriesId != null && seriesId.equals(recurringSeriesId);
    }
}
