package com.flagship.budget_engine.exception;

/**
 * Error taxonomy shared by all engine exceptions and by facade results.
 */
public enum ErrorCode {
    /** An active budget period already exists, or the period was closed on another date. */
    CONFLICT,
    /** No active period, series or user. */
    NOT_FOUND,
    /** Bad date ordering. */
    INVALID_RANGE,
    UNSUPPORTED_FREQUENCY,
    /** Opaque wrapper for data port failures. */
    PERSISTENCE
}
