package com.everrich.cashflow.entities;

/**
 * Direction of a transaction. Decides the sign a magnitude gets when it is applied to a balance.
 */
public enum TransactionType {
    INCOME,
    EXPENSE
}
