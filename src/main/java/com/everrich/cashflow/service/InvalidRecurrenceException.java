package com.everrich.cashflow.service;

/**
 * A recurring transaction definition was rejected while it was being created or updated.
 * Stored series are always valid, so expansion never raises this.
 */
public class InvalidRecurrenceException extends RuntimeException {

    public InvalidRecurrenceException(String message) {
        super(message);
    }

    public InvalidRecurrenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
