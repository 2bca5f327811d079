package com.everrich.cashflow.forecast;

import java.time.LocalDate;

/**
 * Closed calendar interval: both start and end are part of the window.
 */
public record DateWindow(LocalDate start, LocalDate end) {

    public DateWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Window start and end are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Window start " + start + " is after end " + end);
        }
    }

    /**
     * The window of {@code numDays} days beginning at {@code start}.
     */
    public static DateWindow ofDays(LocalDate start, int numDays) {
        if (numDays < 1) {
            throw new IllegalArgumentException("A window spans at least one day, got " + numDays);
        }
        return new DateWindow(start, start.plusDays(numDays - 1L));
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }
}
