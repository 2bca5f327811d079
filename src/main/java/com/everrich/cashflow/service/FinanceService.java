package com.everrich.cashflow.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.everrich.cashflow.config.ForecastProperties;
import com.everrich.cashflow.entities.RecurringTransaction;
import com.everrich.cashflow.entities.Transaction;
import com.everrich.cashflow.forecast.DateWindow;
import com.everrich.cashflow.forecast.ForecastDataSource;
import com.everrich.cashflow.forecast.ForecastDay;
import com.everrich.cashflow.forecast.ForecastEngine;
import com.everrich.cashflow.forecast.LowestPoint;
import com.everrich.cashflow.forecast.LowestPointAnalyzer;
import com.everrich.cashflow.forecast.Occurrence;
import com.everrich.cashflow.forecast.TransactionMerger;

/**
 * Entry point for forecasts and projected transaction lists. Reads its inputs from the
 * {@link ForecastDataSource} inside one read-only transaction and hands them to the pure
 * forecast engine; a failing read aborts the call before anything is computed.
 */
@Service
public class FinanceService {

    private static final Logger log = LoggerFactory.getLogger(FinanceService.class);

    private final ForecastDataSource forecastDataSource;
    private final ForecastEngine forecastEngine;
    private final TransactionMerger transactionMerger;
    private final LowestPointAnalyzer lowestPointAnalyzer;
    private final ForecastProperties forecastProperties;
    private final Clock clock;

    public FinanceService(ForecastDataSource forecastDataSource,
                          ForecastEngine forecastEngine,
                          TransactionMerger transactionMerger,
                          LowestPointAnalyzer lowestPointAnalyzer,
                          ForecastProperties forecastProperties,
                          Clock clock) {
        this.forecastDataSource = forecastDataSource;
        this.forecastEngine = forecastEngine;
        this.transactionMerger = transactionMerger;
        this.lowestPointAnalyzer = lowestPointAnalyzer;
        this.forecastProperties = forecastProperties;
        this.clock = clock;
        log.info("FinanceService initialized with default forecast of {} days", forecastProperties.getDefaultDays());
    }

    /**
     * Daily balances for {@code numDays} days starting at {@code windowStart}.
     */
    @Transactional(readOnly = true)
    public List<ForecastDay> computeForecast(BigDecimal startingBalance, LocalDate windowStart, int numDays) {
        if (numDays < 0) {
            throw new IllegalArgumentException("Number of forecast days must not be negative: " + numDays);
        }
        if (numDays == 0) {
            return List.of();
        }
        DateWindow window = DateWindow.ofDays(windowStart, numDays);
        List<Transaction> oneOffs = forecastDataSource.listOneOffTransactions(window);
        List<RecurringTransaction> activeSeries = forecastDataSource.listActiveRecurringSeries();
        log.debug("Computing forecast for {}..{} from {} one-off(s) and {} active series",
                window.start(), window.end(), oneOffs.size(), activeSeries.size());
        return forecastEngine.forecast(startingBalance, windowStart, numDays, oneOffs, activeSeries);
    }

    /**
     * All active recurring series expanded over {@code [windowStart, windowEnd]}, ordered by date
     * then description.
     */
    @Transactional(readOnly = true)
    public List<Occurrence> expandRecurringBetween(LocalDate windowStart, LocalDate windowEnd) {
        DateWindow window = new DateWindow(windowStart, windowEnd);
        List<Occurrence> projected = forecastEngine.expandAll(forecastDataSource.listActiveRecurringSeries(), window);
        return transactionMerger.merge(List.of(), projected);
    }

    public LowestPoint findLowestPoint(List<ForecastDay> forecast) {
        return lowestPointAnalyzer.findLowest(forecast);
    }

    /**
     * Ledger entries in {@code [start, end]} merged with the active series projected over the
     * same window.
     */
    @Transactional(readOnly = true)
    public List<Occurrence> getTransactionsWithRecurringsBetween(LocalDate start, LocalDate end) {
        DateWindow window = new DateWindow(start, end);
        List<Occurrence> oneOffs = new ArrayList<>();
        for (Transaction transaction : forecastDataSource.listOneOffTransactions(window)) {
            oneOffs.add(Occurrence.persisted(transaction));
        }
        List<Occurrence> projected = forecastEngine.expandAll(forecastDataSource.listActiveRecurringSeries(), window);
        return transactionMerger.merge(oneOffs, projected);
    }

    /**
     * Known and projected transactions from today through {@code today + days}.
     */
    @Transactional(readOnly = true)
    public List<Occurrence> getUpcomingTransactions(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("Days must not be negative: " + days);
        }
        LocalDate today = today();
        return getTransactionsWithRecurringsBetween(today, today.plusDays(days));
    }

    /**
     * Forecast from today using the recorded starting balance.
     *
     * @param days forecast length, or null for the configured default
     */
    @Transactional(readOnly = true)
    public List<ForecastDay> calculateForecast(Integer days) {
        int numDays = resolveForecastDays(days);
        BigDecimal startingBalance = forecastDataSource.getStartingBalance();
        return computeForecast(startingBalance, today(), numDays);
    }

    @Transactional(readOnly = true)
    public LowestPoint getLowestPoint(Integer days) {
        return findLowestPoint(calculateForecast(days));
    }

    private int resolveForecastDays(Integer days) {
        if (days == null) {
            return forecastProperties.getDefaultDays();
        }
        if (days < 1 || days > forecastProperties.getMaxDays()) {
            throw new IllegalArgumentException(
                    "Forecast days must be between 1 and " + forecastProperties.getMaxDays() + ", got " + days);
        }
        return days;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }
}
