package com.flagship.budget_engine.period;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One accounting window of a user's budgets.
 *
 * Key principles:
 * - Both dates are inclusive calendar days
 * - {@code endDate}, {@code totalSpent}, {@code totalSaved} and {@code categorySpending}
 *   are only set by closing
 * - State changes are immutable (closing returns a new BudgetPeriod)
 */
@Value
@Builder(toBuilder = true)
public class BudgetPeriod {
    UUID id;
    String userId;
    LocalDate startDate;
    LocalDate endDate;
    boolean active;
    BigDecimal totalSpent;
    BigDecimal totalSaved;
    @Builder.Default
    Map<String, BigDecimal> categorySpending = Map.of();
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new open period starting on {@code startDate}.
     */
    public static BudgetPeriod open(String userId, LocalDate startDate, Instant now) {
        return BudgetPeriod.builder()
            .id(UUID.randomUUID())
            .userId(Objects.requireNonNull(userId, "userId"))
            .startDate(Objects.requireNonNull(startDate, "startDate"))
            .active(true)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public PeriodState getState() {
        return isOpen() ? PeriodState.ACTIVE : PeriodState.CLOSED;
    }

    /**
     * The active period: flagged active and without an end date.
     */
    public boolean isOpen() {
        return active && endDate == null;
    }

    /**
     * Transitions the period to CLOSED with the computed totals.
     *
     * @throws IllegalStateException if the period is not open
     */
    public BudgetPeriod close(LocalDate closingDate, BigDecimal spent, BigDecimal saved,
                              Map<String, BigDecimal> spending, Instant now) {
        if (!isOpen()) {
            throw new IllegalStateException(
                String.format("Cannot close budget period %s in %s state. Only ACTIVE periods can be closed.",
                    id, getState()));
        }
        return toBuilder()
            .endDate(closingDate)
            .active(false)
            .totalSpent(spent)
            .totalSaved(saved)
            .categorySpending(Map.copyOf(spending))
            .updatedAt(now)
            .build();
    }
}
