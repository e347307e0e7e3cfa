package com.flagship.budget_engine.exception;

import lombok.Getter;

/**
 * Base type for domain failures raised by the engine.
 *
 * Unchecked, like the rest of the codebase: callers that care about a specific failure
 * catch the subclass, everything else propagates.
 */
@Getter
public abstract class BudgetEngineException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BudgetEngineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected BudgetEngineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
