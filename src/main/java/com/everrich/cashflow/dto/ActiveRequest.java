package com.everrich.cashflow.dto;

public record ActiveRequest(Boolean active) {
}
