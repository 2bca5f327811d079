package com.everrich.cashflow.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import com.everrich.cashflow.entities.RecurrenceInterval;
import com.everrich.cashflow.entities.RecurringTransaction;
import com.everrich.cashflow.entities.Setting;
import com.everrich.cashflow.entities.Transaction;
import com.everrich.cashflow.entities.TransactionType;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class TransactionRepositoryTest {

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private RecurringTransactionRepository recurringTransactionRepository;

    @Autowired
    private SettingRepository settingRepository;

    @BeforeEach
    void setUp() {
        transactionRepository.save(new Transaction(LocalDate.of(2025, 2, 28), new BigDecimal("-10.00"), "Before", TransactionType.EXPENSE));
        transactionRepository.save(new Transaction(LocalDate.of(2025, 3, 1), new BigDecimal("100.00"), "First day", TransactionType.INCOME));
        transactionRepository.save(new Transaction(LocalDate.of(2025, 3, 31), new BigDecimal("-20.00"), "Last day", TransactionType.EXPENSE));
        transactionRepository.save(new Transaction(LocalDate.of(2025, 4, 1), new BigDecimal("-30.00"), "After", TransactionType.EXPENSE));
    }

    @Test
    void dateRangeIsInclusiveOnBothEnds() {
        List<Transaction> found = transactionRepository.findByDateRange(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 31));

        assertThat(found).extracting(Transaction::getDescription).containsExactly("First day", "Last day");
        assertThat(found.get(1).getAmount()).isEqualByComparingTo("-20.00");
        assertThat(found.get(0).getCreatedAt()).isNotNull();
    }

    @Test
    void onlyActiveSeriesAreListedAsActive() {
        RecurringTransaction rent = new RecurringTransaction("Rent", TransactionType.EXPENSE, new BigDecimal("1200.00"),
                LocalDate.of(2025, 1, 1), RecurrenceInterval.MONTHLY);
        RecurringTransaction gym = new RecurringTransaction("Gym", TransactionType.EXPENSE, new BigDecimal("40.00"),
                LocalDate.of(2025, 1, 1), RecurrenceInterval.MONTHLY);
        gym.setActive(false);
        recurringTransactionRepository.save(rent);
        recurringTransactionRepository.save(gym);

        assertThat(recurringTransactionRepository.findByActiveTrueOrderByIdAsc())
                .extracting(RecurringTransaction::getDescription)
                .containsExactly("Rent");
        assertThat(recurringTransactionRepository.findAllByOrderByIdAsc()).hasSize(2);
    }

    @Test
    void settingsAreKeyed() {
        settingRepository.save(new Setting("starting_balance", "500.00"));

        assertThat(settingRepository.findById("starting_balance"))
                .map(Setting::getValue)
                .contains("500.00");
    }
}
