package com.flagship.budget_engine.recurring;

import lombok.Value;

import java.util.UUID;

/**
 * A series that could not be executed in a batch.
 */
@Value
public class ExecutionFailure {

    public static final String INACTIVE = "inactive";
    public static final String PAUSED = "paused";

    UUID seriesId;
    String seriesName;
    String error;
}
