package com.everrich.cashflow.entities;

/**
 * Cadence of a recurring transaction.
 */
public enum RecurrenceInterval {
    /**
     * Every 7 days, phased from the start date.
     */
    WEEKLY,

    /**
     * Every 14 days, phased from the start date.
     */
    BIWEEKLY,

    /**
     * Once per calendar month, on the pinned day or the start date's day (clamped to month end).
     */
    MONTHLY,

    /**
     * Once per year, in the start date's month (clamped to month end).
     */
    YEARLY
}
