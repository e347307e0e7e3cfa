package com.flagship.budget_engine;

import com.flagship.budget_engine.exception.BudgetEngineException;
import com.flagship.budget_engine.exception.ErrorCode;
import com.flagship.budget_engine.period.BudgetPeriod;
import lombok.Value;

/**
 * Host-facing result of a period operation: either a period or an error, never an exception
 * for domain failures.
 *
 * After a close, {@code nextPeriod} is the chained period, or null with
 * {@code nextPeriodError} set when the chained start failed.
 */
@Value
public class PeriodResult {
    BudgetPeriod period;
    BudgetPeriod nextPeriod;
    ErrorCode errorCode;
    String error;
    String nextPeriodError;

    public static PeriodResult of(BudgetPeriod period) {
        return new PeriodResult(period, null, null, null, null);
    }

    public static PeriodResult closed(BudgetPeriod period, BudgetPeriod nextPeriod, String nextPeriodError) {
        return new PeriodResult(period, nextPeriod, null, null, nextPeriodError);
    }

    public static PeriodResult failure(BudgetEngineException e) {
        return new PeriodResult(null, null, e.getErrorCode(), e.getMessage(), null);
    }

    public boolean isSuccess() {
        return errorCode == null;
    }
}
