package com.flagship.budget_engine.recurring;

import lombok.Value;

@Value
public class MissedExecution {
    RecurringTransactionSeries series;
    int missedCount;
}
