package com.flagship.budget_engine.common;

import com.flagship.budget_engine.exception.InvalidRangeException;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Inclusive instant window {@code [start, end]}.
 *
 * A null {@code end} means the window is open-ended (an active budget period).
 * Calendar-day windows are built with {@link #ofDays(LocalDate, LocalDate, ZoneId)} so
 * that the last day is covered up to 23:59:59.999 in the given zone.
 */
@Value
public class DateRange {

    /** Last representable millisecond of a calendar day. */
    public static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);

    Instant start;
    Instant end;

    private DateRange(Instant start, Instant end) {
        if (start == null) {
            throw new IllegalArgumentException("Range start is required");
        }
        if (end != null && end.isBefore(start)) {
            throw new InvalidRangeException(
                String.format("Range end %s is before range start %s", end, start));
        }
        this.start = start;
        this.end = end;
    }

    public static DateRange of(Instant start, Instant end) {
        return new DateRange(start, end);
    }

    /**
     * Window from the start of {@code startDay} to the end of {@code endDay} in {@code zone}.
     * A null {@code endDay} produces an open-ended window.
     */
    public static DateRange ofDays(LocalDate startDay, LocalDate endDay, ZoneId zone) {
        if (startDay == null) {
            throw new IllegalArgumentException("Start day is required");
        }
        if (endDay != null && endDay.isBefore(startDay)) {
            throw new InvalidRangeException(
                String.format("End date %s must be on or after start date %s", endDay, startDay));
        }
        Instant start = startDay.atStartOfDay(zone).toInstant();
        return new DateRange(start, endDay != null ? endOfDay(endDay, zone) : null);
    }

    /**
     * Normalizes a calendar day to its last millisecond (23:59:59.999) in {@code zone}.
     */
    public static Instant endOfDay(LocalDate day, ZoneId zone) {
        return day.atTime(END_OF_DAY).atZone(zone).toInstant();
    }

    public boolean isOpenEnded() {
        return end == null;
    }

    /**
     * Inclusive containment on both bounds. Null instants are never contained.
     */
    public boolean contains(Instant instant) {
        if (instant == null) {
            return false;
        }
        if (instant.isBefore(start)) {
            return false;
        }
        return end == null || !instant.isAfter(end);
    }
}
