package com.everrich.cashflow.entities;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A recurring series (paycheck, bill, subscription) that is projected into the future.
 * The amount is always a positive magnitude; the type decides the sign of every occurrence.
 */
@Getter
@Setter
@Entity
@Table(name = "RECURRING_TRANSACTION")
@NoArgsConstructor
public class RecurringTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 1000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private TransactionType type;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    /**
     * Anchor of the series: the phase origin for weekly/biweekly cadences and
     * the earliest date any occurrence may fall on.
     */
    @Column(nullable = false)
    private LocalDate startDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "recurrence_interval", nullable = false, length = 10)
    private RecurrenceInterval interval;

    /**
     * 0 = Sunday ... 6 = Saturday. Only meaningful for weekly/biweekly series.
     */
    private Integer dayOfWeek;

    /**
     * 1..31, clamped to the length of each month. Used by monthly/yearly series.
     */
    private Integer dayOfMonth;

    /**
     * Inclusive. Null means the series never ends.
     */
    private LocalDate endDate;

    @Column(nullable = false)
    private boolean active = true;

    public RecurringTransaction(String description, TransactionType type, BigDecimal amount,
                                LocalDate startDate, RecurrenceInterval interval) {
        this.description = description;
        this.type = type;
        this.amount = amount;
        this.startDate = startDate;
        this.interval = interval;
    }

    /**
     * The weekday occurrences of a weekly/biweekly series land on.
     */
    public DayOfWeek targetDayOfWeek() {
        if (dayOfWeek == null) {
            return startDate.getDayOfWeek();
        }
        return dayOfWeek == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(dayOfWeek);
    }

    /**
     * The day of month occurrences of a monthly/yearly series aim for, before clamping.
     */
    public int targetDayOfMonth() {
        return dayOfMonth != null ? dayOfMonth : startDate.getDayOfMonth();
    }
}
