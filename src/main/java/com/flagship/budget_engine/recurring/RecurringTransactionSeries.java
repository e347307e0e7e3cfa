package com.flagship.budget_engine.recurring;

import com.flagship.budget_engine.transaction.NewTransaction;
import com.flagship.budget_engine.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Template that periodically materializes concrete transactions.
 *
 * Invariants maintained by the execution engine:
 * - totalExecutions == transactionIds.size() after every successful execution
 * - dueDate only moves forward, one frequency interval per execution
 *
 * Creation, editing and deactivation belong to the host.
 */
@Value
@Builder(toBuilder = true)
public class RecurringTransactionSeries {
    UUID id;
    String userId;
    String accountId;
    String toAccountId;
    String groupId;
    String description;
    BigDecimal amount;
    TransactionType type;
    String category;
    Frequency frequency;
    LocalDate dueDate;
    boolean active;
    boolean paused;

    /**
     * Series without auto-execution only run in forced batches.
     */
    @Builder.Default
    boolean autoExecute = true;

    int totalExecutions;
    @Builder.Default
    List<UUID> transactionIds = List.of();
    int failedExecutions;
    Instant lastExecutedAt;

    /**
     * Transaction-creation command for one execution of this series at {@code executedAt}.
     * Copies the template, counterpart account and group included.
     */
    public NewTransaction toTransaction(Instant executedAt) {
        return NewTransaction.builder()
            .recurringSeriesId(Objects.requireNonNull(id, "id"))
            .userId(userId)
            .accountId(accountId)
            .toAccountId(toAccountId)
            .groupId(groupId)
            .type(type)
            .amount(amount)
            .category(category)
            .description(description)
            .date(Objects.requireNonNull(executedAt, "executedAt"))
            .build();
    }
}
