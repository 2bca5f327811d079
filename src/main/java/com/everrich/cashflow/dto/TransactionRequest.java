package com.everrich.cashflow.dto;

import java.math.BigDecimal;

/**
 * Body of the add-income / add-expense calls. The amount is a positive magnitude; the endpoint
 * decides the sign. The date accepts {@code yyyy-MM-dd} or an ISO timestamp.
 */
public record TransactionRequest(String date, BigDecimal amount, String description) {
}
