package com.flagship.budget_engine.budget;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;
import java.util.UUID;

/**
 * Spend of a single budget within a period window.
 */
@Value
public class BudgetProgress {
    UUID budgetId;
    String description;
    BigDecimal amount;
    BigDecimal spent;
    BigDecimal remaining;
    BigDecimal percentage;
    Set<String> categories;
    int transactionCount;

    public boolean isOverspent() {
        return remaining.signum() < 0;
    }
}
