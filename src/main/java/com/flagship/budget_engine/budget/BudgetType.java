package com.flagship.budget_engine.budget;

public enum BudgetType {
    MONTHLY,
    ANNUALLY
}
