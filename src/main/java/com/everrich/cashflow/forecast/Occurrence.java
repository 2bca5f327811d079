package com.everrich.cashflow.forecast;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.everrich.cashflow.entities.RecurringTransaction;
import com.everrich.cashflow.entities.Transaction;
import com.everrich.cashflow.entities.TransactionType;
import com.everrich.cashflow.util.MoneyUtils;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A concrete dated money movement, either read from the ledger or projected from a recurring
 * series. Occurrences are computed per request and never stored.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "source")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Occurrence.Persisted.class, name = "persisted"),
    @JsonSubTypes.Type(value = Occurrence.Projected.class, name = "projected")
})
public interface Occurrence {

    LocalDate date();

    /**
     * Signed: negative for expenses.
     */
    BigDecimal amount();

    String description();

    TransactionType type();

    /**
     * A one-off transaction as stored in the ledger.
     */
    record Persisted(Long transactionId, LocalDate date, BigDecimal amount, String description,
                     TransactionType type) implements Occurrence {
    }

    /**
     * One occurrence of a recurring series.
     */
    record Projected(Long seriesId, LocalDate date, BigDecimal amount, String description,
                     TransactionType type) implements Occurrence {
    }

    static Occurrence persisted(Transaction transaction) {
        return new Persisted(transaction.getId(), transaction.getDate(), transaction.getAmount(),
                transaction.getDescription(), transaction.getType());
    }

    static Occurrence projected(RecurringTransaction series, LocalDate date) {
        return new Projected(series.getId(), date, MoneyUtils.signed(series.getAmount(), series.getType()),
                series.getDescription(), series.getType());
    }
}
