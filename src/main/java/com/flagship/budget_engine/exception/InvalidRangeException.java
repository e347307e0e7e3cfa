package com.flagship.budget_engine.exception;

/**
 * Raised for bad date ordering (end before start, a new period starting before the
 * previous one ended).
 */
public class InvalidRangeException extends BudgetEngineException {

    public InvalidRangeException(String message) {
        super(ErrorCode.INVALID_RANGE, message);
    }
}
