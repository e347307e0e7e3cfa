package com.flagship.budget_engine.exception;

public class UnsupportedFrequencyException extends BudgetEngineException {

    public UnsupportedFrequencyException(String frequency) {
        super(ErrorCode.UNSUPPORTED_FREQUENCY, "Unsupported frequency: " + frequency);
    }
}
