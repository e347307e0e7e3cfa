package com.flagship.budget_engine.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Monetary arithmetic helpers.
 *
 * All amounts handled by the engine are {@link BigDecimal} values in a single currency.
 * Rounding is always to 2 decimal places, half-up, and is applied to aggregates rather
 * than to individual rows so that sums do not drift.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, ROUNDING);

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private Money() {
        // Utility class
    }

    /**
     * Rounds an amount to 2 decimal places (half-up). A null amount is treated as zero.
     */
    public static BigDecimal round(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(SCALE, ROUNDING);
    }

    /**
     * Null-safe view of an amount, without rounding.
     */
    public static BigDecimal orZero(BigDecimal amount) {
        return amount != null ? amount : BigDecimal.ZERO;
    }

    /**
     * Sums amounts without intermediate rounding.
     */
    public static BigDecimal sum(Collection<BigDecimal> amounts) {
        return amounts.stream()
            .map(Money::orZero)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Returns {@code max(0, amount)}.
     */
    public static BigDecimal floorAtZero(BigDecimal amount) {
        BigDecimal value = orZero(amount);
        return value.signum() < 0 ? BigDecimal.ZERO.setScale(value.scale(), ROUNDING) : value;
    }

    /**
     * Computes {@code part / whole * 100} rounded to 2 places; 0 when {@code whole} is zero.
     */
    public static BigDecimal percentage(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) {
            return ZERO;
        }
        return orZero(part)
            .multiply(ONE_HUNDRED)
            .divide(whole, SCALE, ROUNDING);
    }
}
