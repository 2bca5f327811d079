package com.everrich.cashflow.controller;

import com.everrich.cashflow.config.ForecastProperties;
import com.everrich.cashflow.dto.TransactionRequest;
import com.everrich.cashflow.entities.Transaction;
import com.everrich.cashflow.forecast.Occurrence;
import com.everrich.cashflow.service.FinanceService;
import com.everrich.cashflow.service.TransactionService;
import com.everrich.cashflow.util.DateUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/transactions")
public class TransactionRESTController {

    private static final Logger log = LoggerFactory.getLogger(TransactionRESTController.class);

    private final TransactionService transactionService;
    private final FinanceService financeService;
    private final ForecastProperties forecastProperties;

    public TransactionRESTController(TransactionService transactionService,
                                     FinanceService financeService,
                                     ForecastProperties forecastProperties) {
        this.transactionService = transactionService;
        this.financeService = financeService;
        this.forecastProperties = forecastProperties;
    }

    @GetMapping
    public List<Transaction> getTransactions() {
        return transactionService.findAll();
    }

    @PostMapping("/income")
    public ResponseEntity<Transaction> addIncome(@RequestBody TransactionRequest request) {
        log.info("REST Endpoint Call for Add Income");
        Transaction saved = transactionService.addIncome(
                DateUtils.parseDate(request.date()), request.amount(), request.description());
        return new ResponseEntity<>(saved, HttpStatus.CREATED);
    }

    @PostMapping("/expense")
    public ResponseEntity<Transaction> addExpense(@RequestBody TransactionRequest request) {
        log.info("REST Endpoint Call for Add Expense");
        Transaction saved = transactionService.addExpense(
                DateUtils.parseDate(request.date()), request.amount(), request.description());
        return new ResponseEntity<>(saved, HttpStatus.CREATED);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> deleteTransaction(@PathVariable Long id) {
        transactionService.deleteTransaction(id);
        return ResponseEntity.ok(Map.of("status", "success"));
    }

    /**
     * Ledger entries plus projected recurring occurrences between two dates, both inclusive.
     */
    @GetMapping("/between")
    public ResponseEntity<List<Occurrence>> getTransactionsBetween(
            @RequestParam(value = "start", required = false) String startStr,
            @RequestParam(value = "end", required = false) String endStr) {

        if (startStr == null || startStr.isBlank() || endStr == null || endStr.isBlank()) {
            throw new IllegalArgumentException("Both 'start' and 'end' query parameters are required");
        }
        LocalDate start = DateUtils.parseDate(startStr);
        LocalDate end = DateUtils.parseDate(endStr);
        return ResponseEntity.ok(financeService.getTransactionsWithRecurringsBetween(start, end));
    }

    /**
     * Ledger entries plus projected occurrences from today on. A missing or unusable
     * {@code days} value falls back to the configured default.
     */
    @GetMapping("/upcoming")
    public List<Occurrence> getUpcoming(@RequestParam(value = "days", required = false) String daysStr) {
        int days = forecastProperties.getUpcomingDefaultDays();
        if (daysStr != null && !daysStr.isBlank()) {
            try {
                int requested = Integer.parseInt(daysStr.trim());
                if (requested > 0 && requested <= forecastProperties.getMaxDays()) {
                    days = requested;
                }
            } catch (NumberFormatException e) {
                log.debug("Ignoring invalid days parameter '{}', using {}", daysStr, days);
            }
        }
        return financeService.getUpcomingTransactions(days);
    }
}
