package com.flagship.budget_engine.exception;

/**
 * Raised when a state transition collides with the current state, e.g. starting a period
 * while another one is still active.
 */
public class ConflictException extends BudgetEngineException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
