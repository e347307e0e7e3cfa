package com.flagship.budget_engine.exception;

/**
 * Opaque wrapper for failures of the host's data port.
 *
 * Propagates out of batch operations: partial progress without a reliable commit log
 * would corrupt reconciliation.
 */
public class PersistenceException extends BudgetEngineException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE, message, cause);
    }
}
