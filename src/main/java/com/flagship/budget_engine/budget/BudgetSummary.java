package com.flagship.budget_engine.budget;

import com.flagship.budget_engine.common.DateRange;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Budget progress for one user over the active period window.
 */
@Value
public class BudgetSummary {
    String userId;
    DateRange window;
    List<BudgetProgress> budgets;
    BigDecimal totalBudget;
    BigDecimal totalSpent;
    BigDecimal totalRemaining;
    BigDecimal overallPercentage;
}
