package com.flagship.budget_engine.exception;

public class NotFoundException extends BudgetEngineException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
