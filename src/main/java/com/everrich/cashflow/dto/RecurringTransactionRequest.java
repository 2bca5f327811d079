package com.everrich.cashflow.dto;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Create/update payload for a recurring transaction. Interval and type arrive as free text and
 * are validated by the service; snake_case field names are accepted as well.
 *
 * @param type       "income" or "expense"
 * @param interval   "weekly", "biweekly", "monthly" or "yearly"
 * @param dayOfWeek  optional, 0 = Sunday ... 6 = Saturday
 * @param dayOfMonth optional, 1..31
 * @param endDate    optional, inclusive
 * @param active     defaults to true when omitted
 */
public record RecurringTransactionRequest(
        String description,
        String type,
        BigDecimal amount,
        @JsonAlias("start_date") String startDate,
        String interval,
        @JsonAlias("day_of_week") Integer dayOfWeek,
        @JsonAlias("day_of_month") Integer dayOfMonth,
        @JsonAlias("end_date") String endDate,
        Boolean active) {
}
