package com.flagship.budget_engine.budget;

import com.flagship.budget_engine.common.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;
import java.util.UUID;

/**
 * A spending envelope over a set of categories. Read-only input to the engine.
 */
@Value
@Builder(toBuilder = true)
public class Budget {
    UUID id;
    String userId;
    String groupId;
    String description;
    BigDecimal amount;
    BudgetType type;
    @Builder.Default
    Set<String> categories = Set.of();

    /**
     * Budgets without an owner belong to nobody.
     */
    public boolean belongsTo(String candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }

    public boolean hasPositiveAmount() {
        return Money.orZero(amount).signum() > 0;
    }
}
