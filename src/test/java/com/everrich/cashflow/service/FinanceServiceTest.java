package com.everrich.cashflow.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import com.everrich.cashflow.config.ForecastProperties;
import com.everrich.cashflow.entities.RecurrenceInterval;
import com.everrich.cashflow.entities.RecurringTransaction;
import com.everrich.cashflow.entities.Transaction;
import com.everrich.cashflow.entities.TransactionType;
import com.everrich.cashflow.forecast.DateWindow;
import com.everrich.cashflow.forecast.EmptyForecastException;
import com.everrich.cashflow.forecast.ForecastDataSource;
import com.everrich.cashflow.forecast.ForecastDay;
import com.everrich.cashflow.forecast.ForecastEngine;
import com.everrich.cashflow.forecast.LowestPoint;
import com.everrich.cashflow.forecast.LowestPointAnalyzer;
import com.everrich.cashflow.forecast.Occurrence;
import com.everrich.cashflow.forecast.RecurrenceExpander;
import com.everrich.cashflow.forecast.TransactionMerger;

@ExtendWith(MockitoExtension.class)
class FinanceServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 1);

    @Mock
    private ForecastDataSource forecastDataSource;

    private FinanceService financeService;

    @BeforeEach
    void setUp() {
        TransactionMerger merger = new TransactionMerger();
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:15:30Z"), ZoneOffset.UTC);
        financeService = new FinanceService(forecastDataSource, new ForecastEngine(new RecurrenceExpander(), merger),
                merger, new LowestPointAnalyzer(), new ForecastProperties(), clock);
    }

    private static Transaction transaction(long id, LocalDate date, String amount, String description) {
        BigDecimal value = new BigDecimal(amount);
        Transaction transaction = new Transaction(date, value, description,
                value.signum() < 0 ? TransactionType.EXPENSE : TransactionType.INCOME);
        transaction.setId(id);
        return transaction;
    }

    private static RecurringTransaction series(long id, String description, RecurrenceInterval interval,
                                               TransactionType type, String amount, LocalDate start) {
        RecurringTransaction series = new RecurringTransaction(description, type, new BigDecimal(amount), start, interval);
        series.setId(id);
        return series;
    }

    @Test
    void calculateForecastStartsTodayWithStoredBalance() {
        when(forecastDataSource.getStartingBalance()).thenReturn(new BigDecimal("1000.00"));
        when(forecastDataSource.listOneOffTransactions(new DateWindow(TODAY, TODAY.plusDays(2))))
                .thenReturn(List.of(transaction(1, TODAY.plusDays(1), "-1500.00", "Car repair")));
        when(forecastDataSource.listActiveRecurringSeries()).thenReturn(List.of());

        List<ForecastDay> days = financeService.calculateForecast(3);

        assertThat(days).extracting(ForecastDay::date).containsExactly(TODAY, TODAY.plusDays(1), TODAY.plusDays(2));
        assertThat(days).extracting(ForecastDay::balance)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("1000"), new BigDecimal("-500"), new BigDecimal("-500"));
    }

    @Test
    void defaultForecastLengthComesFromProperties() {
        when(forecastDataSource.getStartingBalance()).thenReturn(BigDecimal.ZERO);
        when(forecastDataSource.listOneOffTransactions(any())).thenReturn(List.of());
        when(forecastDataSource.listActiveRecurringSeries()).thenReturn(List.of());

        assertThat(financeService.calculateForecast(null)).hasSize(90);
    }

    @Test
    void forecastLengthOutOfRangeIsRejected() {
        assertThatThrownBy(() -> financeService.calculateForecast(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> financeService.calculateForecast(3661)).isInstanceOf(IllegalArgumentException.class);
        verify(forecastDataSource, never()).getStartingBalance();
    }

    @Test
    void lowestPointOfForecast() {
        when(forecastDataSource.getStartingBalance()).thenReturn(new BigDecimal("1000.00"));
        when(forecastDataSource.listOneOffTransactions(any()))
                .thenReturn(List.of(transaction(1, TODAY.plusDays(1), "-1500.00", "Car repair")));
        when(forecastDataSource.listActiveRecurringSeries()).thenReturn(List.of());

        LowestPoint lowest = financeService.getLowestPoint(3);

        assertThat(lowest.dayIndex()).isEqualTo(1);
        assertThat(lowest.lowestPoint().balance()).isEqualByComparingTo("-500");
    }

    @Test
    void lowestPointOfEmptyForecastFails() {
        assertThatThrownBy(() -> financeService.findLowestPoint(List.of())).isInstanceOf(EmptyForecastException.class);
    }

    @Test
    void zeroDayComputeReadsNothing() {
        assertThat(financeService.computeForecast(BigDecimal.ONE, TODAY, 0)).isEmpty();
        verify(forecastDataSource, never()).listActiveRecurringSeries();
    }

    @Test
    void dataSourceFailureAbortsForecast() {
        when(forecastDataSource.getStartingBalance()).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> financeService.calculateForecast(10))
                .isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void upcomingMergesLedgerAndProjections() {
        when(forecastDataSource.listOneOffTransactions(new DateWindow(TODAY, TODAY.plusDays(14))))
                .thenReturn(List.of(transaction(1, TODAY.plusDays(3), "-20.00", "Books")));
        when(forecastDataSource.listActiveRecurringSeries()).thenReturn(List.of(
                series(9, "Allowance", RecurrenceInterval.WEEKLY, TransactionType.INCOME, "50.00", TODAY)));

        List<Occurrence> upcoming = financeService.getUpcomingTransactions(14);

        assertThat(upcoming).extracting(Occurrence::date)
                .containsExactly(TODAY, TODAY.plusDays(3), TODAY.plusDays(7), TODAY.plusDays(14));
        assertThat(upcoming.get(1)).isInstanceOf(Occurrence.Persisted.class);
        assertThat(upcoming.get(0)).isInstanceOf(Occurrence.Projected.class);
    }

    @Test
    void expandRecurringBetweenOrdersByDateThenDescription() {
        when(forecastDataSource.listActiveRecurringSeries()).thenReturn(List.of(
                series(1, "Water", RecurrenceInterval.MONTHLY, TransactionType.EXPENSE, "30.00", LocalDate.of(2025, 1, 5)),
                series(2, "Electricity", RecurrenceInterval.MONTHLY, TransactionType.EXPENSE, "80.00", LocalDate.of(2025, 1, 5))));

        List<Occurrence> occurrences = financeService.expandRecurringBetween(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 4, 30));

        assertThat(occurrences).extracting(Occurrence::description)
                .containsExactly("Electricity", "Water", "Electricity", "Water");
        assertThat(occurrences).extracting(Occurrence::amount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("-80"), new BigDecimal("-30"), new BigDecimal("-80"), new BigDecimal("-30"));
    }
}
