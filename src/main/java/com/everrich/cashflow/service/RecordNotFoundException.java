package com.everrich.cashflow.service;

public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(String kind, Long id) {
        super(kind + " with ID " + id + " not found.");
    }
}
