package com.flagship.budget_engine.period;

import lombok.Value;

/**
 * Outcome of closing a period.
 *
 * The close itself always succeeded when this object exists. The chained start of the
 * next period may not have: then {@code nextPeriod} is null and {@code nextPeriodError}
 * says why.
 */
@Value
public class PeriodClosure {
    BudgetPeriod closedPeriod;
    BudgetPeriod nextPeriod;
    String nextPeriodError;
    boolean alreadyClosed;

    public static PeriodClosure chained(BudgetPeriod closed, BudgetPeriod next) {
        return new PeriodClosure(closed, next, null, false);
    }

    public static PeriodClosure chainFailed(BudgetPeriod closed, String error) {
        return new PeriodClosure(closed, null, error, false);
    }

    /**
     * Repeated close of a period that is already closed on the requested date.
     */
    public static PeriodClosure unchanged(BudgetPeriod closed) {
        return new PeriodClosure(closed, null, null, true);
    }

    public boolean hasNextPeriod() {
        return nextPeriod != null;
    }
}
