package com.everrich.cashflow.repository;

import com.everrich.cashflow.entities.RecurringTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RecurringTransactionRepository extends JpaRepository<RecurringTransaction, Long> {

    List<RecurringTransaction> findAllByOrderByIdAsc();

    List<RecurringTransaction> findByActiveTrueOrderByIdAsc();
}
