package com.flagship.budget_engine.period;

/**
 * State of a user's budget period.
 *
 * NO_PERIOD → ACTIVE → CLOSED. Closing a period immediately chains a new ACTIVE period,
 * so CLOSED is never the user's current state for long.
 */
public enum PeriodState {
    /**
     * The user has never started budgeting, or the chained start after a close failed.
     */
    NO_PERIOD,

    /**
     * Open window with no end date. At most one per user.
     */
    ACTIVE,

    /**
     * End date set, totals computed. Immutable from here on.
     */
    CLOSED
}
