package com.everrich.cashflow.forecast;

/**
 * The day with the lowest balance in a forecast and its position in the series.
 */
public record LowestPoint(ForecastDay lowestPoint, int dayIndex) {
}
