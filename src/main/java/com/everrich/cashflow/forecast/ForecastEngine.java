package com.everrich.cashflow.forecast;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.everrich.cashflow.entities.RecurringTransaction;
import com.everrich.cashflow.entities.Transaction;
import com.everrich.cashflow.util.MoneyUtils;

/**
 * Projects a daily balance series from a starting balance, one-off transactions and recurring
 * series. Holds no state and never modifies its inputs, so concurrent calls need no locking.
 */
@Component
public class ForecastEngine {

    private static final Logger log = LoggerFactory.getLogger(ForecastEngine.class);

    private final RecurrenceExpander recurrenceExpander;
    private final TransactionMerger transactionMerger;

    public ForecastEngine(RecurrenceExpander recurrenceExpander, TransactionMerger transactionMerger) {
        this.recurrenceExpander = recurrenceExpander;
        this.transactionMerger = transactionMerger;
    }

    /**
     * Builds one {@link ForecastDay} per calendar day in
     * {@code [windowStart, windowStart + numDays - 1]}, including days without activity.
     * One-offs dated outside that window are ignored.
     *
     * @param startingBalance balance before the first day of the window
     * @param windowStart     first forecast day
     * @param numDays         number of days; zero gives an empty forecast
     * @param oneOffs         ledger entries, amounts already signed
     * @param activeSeries    recurring series to project over the window
     */
    public List<ForecastDay> forecast(BigDecimal startingBalance, LocalDate windowStart, int numDays,
                                      Collection<Transaction> oneOffs,
                                      Collection<RecurringTransaction> activeSeries) {
        Objects.requireNonNull(startingBalance, "startingBalance");
        Objects.requireNonNull(windowStart, "windowStart");
        if (numDays < 0) {
            throw new IllegalArgumentException("Number of forecast days must not be negative: " + numDays);
        }
        if (numDays == 0) {
            return List.of();
        }

        DateWindow window = DateWindow.ofDays(windowStart, numDays);
        List<Occurrence> merged = transactionMerger.merge(toOccurrences(oneOffs), expandAll(activeSeries, window));

        Map<LocalDate, BigDecimal> changeByDay = new HashMap<>();
        for (Occurrence occurrence : merged) {
            if (window.contains(occurrence.date())) {
                changeByDay.merge(occurrence.date(), occurrence.amount(), BigDecimal::add);
            }
        }

        List<ForecastDay> days = new ArrayList<>(numDays);
        BigDecimal balance = startingBalance;
        for (int i = 0; i < numDays; i++) {
            LocalDate date = windowStart.plusDays(i);
            BigDecimal change = changeByDay.getOrDefault(date, MoneyUtils.ZERO);
            balance = balance.add(change);
            days.add(new ForecastDay(date, change, balance));
        }

        log.debug("Forecast {}..{}: {} occurrence(s) over {} active day(s), closing balance {}",
                window.start(), window.end(), merged.size(), changeByDay.size(), balance);
        return Collections.unmodifiableList(days);
    }

    /**
     * Expands every series over the window, in series order.
     */
    public List<Occurrence> expandAll(Collection<RecurringTransaction> series, DateWindow window) {
        List<Occurrence> projected = new ArrayList<>();
        for (RecurringTransaction s : series) {
            projected.addAll(recurrenceExpander.expand(s, window.start(), window.end()));
        }
        return projected;
    }

    private static List<Occurrence> toOccurrences(Collection<Transaction> oneOffs) {
        List<Occurrence> occurrences = new ArrayList<>(oneOffs.size());
        for (Transaction transaction : oneOffs) {
            occurrences.add(Occurrence.persisted(transaction));
        }
        return occurrences;
    }
}
