package com.everrich.cashflow.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.everrich.cashflow.entities.TransactionType;

/**
 * Conversions between monetary representations.
 * Amounts are carried as {@link BigDecimal} everywhere inside the application; JSON numbers bind
 * straight to it and stored settings go through the canonical text form. Rounding happens only
 * here, never while balances are accumulated.
 */
public final class MoneyUtils {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private MoneyUtils() {
    }

    /**
     * Brings a value to the canonical scale of two fraction digits.
     */
    public static BigDecimal normalize(BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("Amount must not be null");
        }
        return value.setScale(SCALE, ROUNDING);
    }

    /**
     * Parses a plain decimal string such as {@code "1250.5"} or {@code "-12.30"}.
     */
    public static BigDecimal parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Amount is empty");
        }
        try {
            return normalize(new BigDecimal(text.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount: " + text, e);
        }
    }

    /**
     * Canonical text form used for storage, always two fraction digits and never exponent notation.
     */
    public static String format(BigDecimal value) {
        return normalize(value).toPlainString();
    }

    /**
     * Applies the sign of a transaction type to a positive magnitude.
     */
    public static BigDecimal signed(BigDecimal magnitude, TransactionType type) {
        return type == TransactionType.EXPENSE ? magnitude.negate() : magnitude;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
