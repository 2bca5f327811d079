package com.everrich.cashflow.forecast;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One calendar day of a forecast: the net change of that day and the balance after it.
 */
public record ForecastDay(LocalDate date, BigDecimal change, BigDecimal balance) {
}
