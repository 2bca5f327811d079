package com.everrich.cashflow.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.everrich.cashflow.entities.Transaction;
import com.everrich.cashflow.entities.TransactionType;
import com.everrich.cashflow.repository.TransactionRepository;
import com.everrich.cashflow.util.MoneyUtils;

/**
 * Ledger of one-off transactions. Expenses are stored with a negative amount so that a day's
 * net change is the plain sum of its amounts.
 */
@Service
public class TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    private final TransactionRepository transactionRepository;

    public TransactionService(TransactionRepository transactionRepository) {
        this.transactionRepository = transactionRepository;
        log.info("Transaction Service Wired Successfully");
    }

    @Transactional
    public Transaction addIncome(LocalDate date, BigDecimal amount, String description) {
        return addTransaction(date, amount, description, TransactionType.INCOME);
    }

    @Transactional
    public Transaction addExpense(LocalDate date, BigDecimal amount, String description) {
        return addTransaction(date, amount, description, TransactionType.EXPENSE);
    }

    private Transaction addTransaction(LocalDate date, BigDecimal amount, String description, TransactionType type) {
        if (date == null) {
            throw new IllegalArgumentException("Transaction date is required");
        }
        if (!MoneyUtils.isPositive(amount)) {
            throw new IllegalArgumentException("Transaction amount must be greater than zero");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Transaction description is required");
        }
        BigDecimal signedAmount = MoneyUtils.signed(MoneyUtils.normalize(amount), type);
        Transaction saved = transactionRepository.save(new Transaction(date, signedAmount, description.trim(), type));
        log.info("Saved {} transaction ID {}: {} | {} | {}", type, saved.getId(), date, signedAmount, saved.getDescription());
        return saved;
    }

    public List<Transaction> findAll() {
        return transactionRepository.findAllByOrderByDateAscIdAsc();
    }

    @Transactional
    public void deleteTransaction(Long id) {
        if (!transactionRepository.existsById(id)) {
            throw new RecordNotFoundException("Transaction", id);
        }
        transactionRepository.deleteById(id);
        log.info("Deleted transaction ID {}", id);
    }
}
