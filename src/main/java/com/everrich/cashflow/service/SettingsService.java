package com.everrich.cashflow.service;

import java.math.BigDecimal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.everrich.cashflow.entities.Setting;
import com.everrich.cashflow.repository.SettingRepository;
import com.everrich.cashflow.util.MoneyUtils;

@Service
public class SettingsService {

    public static final String STARTING_BALANCE_KEY = "starting_balance";

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    private final SettingRepository settingRepository;

    public SettingsService(SettingRepository settingRepository) {
        this.settingRepository = settingRepository;
    }

    /**
     * The recorded starting balance. No balance recorded yet is a valid first-run state and
     * reads as zero; a stored value that is not a number is an error.
     */
    @Transactional(readOnly = true)
    public BigDecimal getStartingBalance() {
        return settingRepository.findById(STARTING_BALANCE_KEY)
                .map(Setting::getValue)
                .filter(value -> !value.isBlank())
                .map(this::parseStoredBalance)
                .orElse(MoneyUtils.ZERO);
    }

    @Transactional
    public BigDecimal setStartingBalance(BigDecimal balance) {
        if (balance == null) {
            throw new IllegalArgumentException("Balance is required");
        }
        String value = MoneyUtils.format(balance);
        Setting setting = settingRepository.findById(STARTING_BALANCE_KEY)
                .orElseGet(() -> new Setting(STARTING_BALANCE_KEY, value));
        setting.setValue(value);
        settingRepository.save(setting);
        log.info("Starting balance set to {}", value);
        return MoneyUtils.parse(value);
    }

    private BigDecimal parseStoredBalance(String value) {
        try {
            return MoneyUtils.parse(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Stored starting balance is not a number: " + value, e);
        }
    }
}
