package com.flagship.budget_engine.period;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Patch applied to a persisted period through the data port. Null fields are unchanged.
 */
@Value
@Builder
public class PeriodUpdate {
    LocalDate endDate;
    Boolean active;
    BigDecimal totalSpent;
    BigDecimal totalSaved;
    Map<String, BigDecimal> categorySpending;
    Instant updatedAt;

    public static PeriodUpdate closing(BudgetPeriod closed) {
        return PeriodUpdate.builder()
            .endDate(closed.getEndDate())
            .active(closed.isActive())
            .totalSpent(closed.getTotalSpent())
            .totalSaved(closed.getTotalSaved())
            .categorySpending(closed.getCategorySpending())
            .updatedAt(closed.getUpdatedAt())
            .build();
    }
}
