package com.everrich.cashflow.service;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.stereotype.Component;

import com.everrich.cashflow.entities.RecurringTransaction;
import com.everrich.cashflow.entities.Transaction;
import com.everrich.cashflow.forecast.DateWindow;
import com.everrich.cashflow.forecast.ForecastDataSource;
import com.everrich.cashflow.repository.RecurringTransactionRepository;
import com.everrich.cashflow.repository.TransactionRepository;

/**
 * Feeds the forecast from the JPA repositories and the settings table.
 */
@Component
public class StoreForecastDataSource implements ForecastDataSource {

    private final TransactionRepository transactionRepository;
    private final RecurringTransactionRepository recurringTransactionRepository;
    private final SettingsService settingsService;

    public StoreForecastDataSource(TransactionRepository transactionRepository,
                                   RecurringTransactionRepository recurringTransactionRepository,
                                   SettingsService settingsService) {
        this.transactionRepository = transactionRepository;
        this.recurringTransactionRepository = recurringTransactionRepository;
        this.settingsService = settingsService;
    }

    @Override
    public List<Transaction> listOneOffTransactions(DateWindow window) {
        return transactionRepository.findByDateRange(window.start(), window.end());
    }

    @Override
    public List<RecurringTransaction> listActiveRecurringSeries() {
        return recurringTransactionRepository.findByActiveTrueOrderByIdAsc();
    }

    @Override
    public BigDecimal getStartingBalance() {
        return settingsService.getStartingBalance();
    }
}
