package com.flagship.budget_engine.recurring;

import com.flagship.budget_engine.exception.UnsupportedFrequencyException;

import java.util.Locale;

/**
 * How often a recurring series fires.
 */
public enum Frequency {
    WEEKLY,
    BIWEEKLY,
    MONTHLY,
    YEARLY;

    /**
     * Parses a host-supplied value such as {@code "monthly"}, ignoring case.
     *
     * @throws UnsupportedFrequencyException for null, blank or unknown values
     */
    public static Frequency fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedFrequencyException(String.valueOf(value));
        }
        try {
            return Frequency.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnsupportedFrequencyException(value);
        }
    }
}
