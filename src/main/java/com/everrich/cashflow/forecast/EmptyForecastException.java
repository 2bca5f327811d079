package com.everrich.cashflow.forecast;

/**
 * Raised when a lowest point is requested for a forecast with no days.
 */
public class EmptyForecastException extends RuntimeException {

    public EmptyForecastException(String message) {
        super(message);
    }
}
