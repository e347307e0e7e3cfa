package com.flagship.budget_engine.recurring;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Patch applied to a persisted series through the data port. Null fields are unchanged.
 */
@Value
@Builder
public class SeriesUpdate {
    Integer totalExecutions;
    LocalDate dueDate;
    List<UUID> transactionIds;
    Integer failedExecutions;
    Instant lastExecutedAt;

    /**
     * Counters after one successful execution that produced {@code transactionId}.
     */
    public static SeriesUpdate afterExecution(RecurringTransactionSeries series, LocalDate nextDue,
                                              UUID transactionId, Instant executedAt) {
        List<UUID> ids = series.getTransactionIds() != null
            ? new ArrayList<>(series.getTransactionIds())
            : new ArrayList<>();
        ids.add(transactionId);
        return SeriesUpdate.builder()
            .totalExecutions(series.getTotalExecutions() + 1)
            .dueDate(nextDue)
            .transactionIds(List.copyOf(ids))
            .lastExecutedAt(executedAt)
            .build();
    }

    public static SeriesUpdate afterFailure(RecurringTransactionSeries series) {
        return SeriesUpdate.builder()
            .failedExecutions(series.getFailedExecutions() + 1)
            .build();
    }
}
