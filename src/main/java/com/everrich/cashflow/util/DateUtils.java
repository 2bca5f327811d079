package com.everrich.cashflow.util;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Calendar date helpers. All business dates are timezone-less {@link LocalDate}s; timestamps
 * coming in from clients are reduced to their calendar date as written, without zone conversion.
 */
public final class DateUtils {

    public static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private DateUtils() {
    }

    /**
     * Parses a date, accepting either {@code yyyy-MM-dd} or an ISO-8601 timestamp with offset.
     *
     * @throws IllegalArgumentException if the text matches none of the accepted formats
     */
    public static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Date is empty");
        }
        String trimmed = text.trim();
        try {
            if (trimmed.indexOf('T') < 0) {
                return LocalDate.parse(trimmed, ISO_DATE);
            }
            // 2025-01-31T00:00:00Z, 2025-01-31T00:00:00.000Z, 2025-01-31T00:00:00-05:00
            return OffsetDateTime.parse(trimmed, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toLocalDate();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unable to parse date: " + text, e);
        }
    }

    public static LocalDate parseOptionalDate(String text) {
        return text == null || text.isBlank() ? null : parseDate(text);
    }

    public static LocalDate max(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    public static LocalDate min(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }
}
