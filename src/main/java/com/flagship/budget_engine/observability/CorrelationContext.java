package com.flagship.budget_engine.observability;

import java.util.UUID;

/**
 * MDC keys used by the engine's structured logging.
 *
 * The run ID ties together every log line of one recurring batch. Keys are put in a
 * {@code try} block and removed in {@code finally} by the code that owns them.
 */
public final class CorrelationContext {

    public static final String RUN_ID_MDC_KEY = "runId";
    public static final String SERIES_ID_MDC_KEY = "seriesId";
    public static final String USER_ID_MDC_KEY = "userId";
    public static final String PERIOD_ID_MDC_KEY = "periodId";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Generates a new run ID.
     * Uses a shorter format for readability in logs.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
