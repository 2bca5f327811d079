package com.everrich.cashflow.dto;

import java.math.BigDecimal;

public record BalanceRequest(BigDecimal balance) {
}
