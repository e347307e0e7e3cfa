package com.flagship.budget_engine.recurring;

import com.flagship.budget_engine.exception.UnsupportedFrequencyException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Advances a due date by exactly one frequency interval.
 *
 * Month and year arithmetic clamps to the last valid day of the target month
 * (Jan 31 + 1 month = Feb 28 in a non-leap year, Feb 29 + 1 year = Feb 28).
 */
@Component
public class DueDateCalculator {

    public LocalDate nextDue(LocalDate currentDue, Frequency frequency) {
        if (currentDue == null) {
            throw new IllegalArgumentException("Current due date is required");
        }
        if (frequency == null) {
            throw new UnsupportedFrequencyException("null");
        }
        return switch (frequency) {
            case WEEKLY -> currentDue.plusWeeks(1);
            case BIWEEKLY -> currentDue.plusWeeks(2);
            case MONTHLY -> currentDue.plusMonths(1);
            case YEARLY -> currentDue.plusYears(1);
        };
    }

    /**
     * Variant for raw host values.
     *
     * @throws UnsupportedFrequencyException if {@code frequency} is not a known frequency
     */
    public LocalDate nextDue(LocalDate currentDue, String frequency) {
        return nextDue(currentDue, Frequency.fromValue(frequency));
    }
}
