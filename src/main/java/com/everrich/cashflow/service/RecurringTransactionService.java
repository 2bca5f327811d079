package com.everrich.cashflow.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.everrich.cashflow.dto.RecurringTransactionRequest;
import com.everrich.cashflow.entities.RecurrenceInterval;
import com.everrich.cashflow.entities.RecurringTransaction;
import com.everrich.cashflow.entities.TransactionType;
import com.everrich.cashflow.repository.RecurringTransactionRepository;
import com.everrich.cashflow.util.DateUtils;
import com.everrich.cashflow.util.MoneyUtils;

/**
 * Manages recurring series. Every definition is validated here, before it is stored, so the
 * forecast engine can rely on a known interval and in-range day pins.
 */
@Service
public class RecurringTransactionService {

    private static final Logger log = LoggerFactory.getLogger(RecurringTransactionService.class);

    private final RecurringTransactionRepository recurringTransactionRepository;

    public RecurringTransactionService(RecurringTransactionRepository recurringTransactionRepository) {
        this.recurringTransactionRepository = recurringTransactionRepository;
    }

    @Transactional
    public RecurringTransaction create(RecurringTransactionRequest request) {
        RecurringTransaction series = new RecurringTransaction();
        apply(series, request);
        RecurringTransaction saved = recurringTransactionRepository.save(series);
        log.info("Created recurring transaction ID {}: {} {} {} from {}", saved.getId(), saved.getInterval(),
                saved.getType(), saved.getAmount(), saved.getStartDate());
        return saved;
    }

    @Transactional
    public RecurringTransaction update(Long id, RecurringTransactionRequest request) {
        RecurringTransaction series = recurringTransactionRepository.findById(id)
                .orElseThrow(() -> new RecordNotFoundException("Recurring transaction", id));
        apply(series, request);
        RecurringTransaction saved = recurringTransactionRepository.save(series);
        log.info("Updated recurring transaction ID {}", id);
        return saved;
    }

    public List<RecurringTransaction> findAll() {
        return recurringTransactionRepository.findAllByOrderByIdAsc();
    }

    @Transactional
    public void delete(Long id) {
        if (!recurringTransactionRepository.existsById(id)) {
            throw new RecordNotFoundException("Recurring transaction", id);
        }
        recurringTransactionRepository.deleteById(id);
        log.info("Deleted recurring transaction ID {}", id);
    }

    @Transactional
    public RecurringTransaction setActive(Long id, boolean active) {
        RecurringTransaction series = recurringTransactionRepository.findById(id)
                .orElseThrow(() -> new RecordNotFoundException("Recurring transaction", id));
        series.setActive(active);
        log.info("Recurring transaction ID {} is now {}", id, active ? "active" : "inactive");
        return recurringTransactionRepository.save(series);
    }

    private void apply(RecurringTransaction series, RecurringTransactionRequest request) {
        if (request == null) {
            throw new InvalidRecurrenceException("Recurring transaction definition is required");
        }
        if (request.description() == null || request.description().isBlank()) {
            throw new InvalidRecurrenceException("Description is required");
        }
        if (!MoneyUtils.isPositive(request.amount())) {
            throw new InvalidRecurrenceException("Amount must be greater than zero");
        }
        RecurrenceInterval interval = parseInterval(request.interval());
        TransactionType type = parseType(request.type());
        LocalDate startDate = parseDate("start date", request.startDate());
        if (startDate == null) {
            throw new InvalidRecurrenceException("Start date is required");
        }
        LocalDate endDate = parseDate("end date", request.endDate());
        if (endDate != null && endDate.isBefore(startDate)) {
            throw new InvalidRecurrenceException("End date " + endDate + " is before start date " + startDate);
        }
        Integer dayOfWeek = request.dayOfWeek();
        if (dayOfWeek != null && (dayOfWeek < 0 || dayOfWeek > 6)) {
            throw new InvalidRecurrenceException("Day of week must be between 0 (Sunday) and 6 (Saturday), got " + dayOfWeek);
        }
        Integer dayOfMonth = request.dayOfMonth();
        if (dayOfMonth != null && (dayOfMonth < 1 || dayOfMonth > 31)) {
            throw new InvalidRecurrenceException("Day of month must be between 1 and 31, got " + dayOfMonth);
        }

        series.setDescription(request.description().trim());
        series.setType(type);
        series.setAmount(MoneyUtils.normalize(request.amount()));
        series.setStartDate(startDate);
        series.setInterval(interval);
        series.setDayOfWeek(dayOfWeek);
        series.setDayOfMonth(dayOfMonth);
        series.setEndDate(endDate);
        series.setActive(request.active() == null || request.active());
    }

    /**
     * Accepts weekly|biweekly|monthly|yearly, ignoring case and surrounding whitespace.
     */
    public static RecurrenceInterval parseInterval(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "WEEKLY":
                return RecurrenceInterval.WEEKLY;
            case "BIWEEKLY":
                return RecurrenceInterval.BIWEEKLY;
            case "MONTHLY":
                return RecurrenceInterval.MONTHLY;
            case "YEARLY":
                return RecurrenceInterval.YEARLY;
            default:
                throw new InvalidRecurrenceException(
                        "Invalid interval \"" + value + "\" (expected weekly|biweekly|monthly|yearly)");
        }
    }

    public static TransactionType parseType(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "INCOME":
                return TransactionType.INCOME;
            case "EXPENSE":
                return TransactionType.EXPENSE;
            default:
                throw new InvalidRecurrenceException("Invalid type \"" + value + "\" (expected income|expense)");
        }
    }

    private static LocalDate parseDate(String field, String value) {
        try {
            return DateUtils.parseOptionalDate(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidRecurrenceException("Invalid " + field + ": " + e.getMessage(), e);
        }
    }
}
