package com.everrich.cashflow.forecast;

import java.math.BigDecimal;
import java.util.List;

import com.everrich.cashflow.entities.RecurringTransaction;
import com.everrich.cashflow.entities.Transaction;

/**
 * Where the forecast gets its inputs from. Failures surface as Spring
 * {@link org.springframework.dao.DataAccessException}s and are not retried.
 */
public interface ForecastDataSource {

    /**
     * One-off transactions dated inside the window (inclusive), ordered by date.
     */
    List<Transaction> listOneOffTransactions(DateWindow window);

    List<RecurringTransaction> listActiveRecurringSeries();

    /**
     * The recorded starting balance, or zero when none has been recorded yet.
     */
    BigDecimal getStartingBalance();
}
