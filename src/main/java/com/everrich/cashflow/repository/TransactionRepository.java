package com.everrich.cashflow.repository;

import com.everrich.cashflow.entities.Transaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {

    /**
     * Transactions dated between the two dates, both inclusive.
     */
    @Query("SELECT t FROM Transaction t " +
           "WHERE t.date >= :startDate AND t.date <= :endDate " +
           "ORDER BY t.date ASC, t.id ASC")
    List<Transaction> findByDateRange(
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);

    List<Transaction> findAllByOrderByDateAscIdAsc();
}
