package com.everrich.cashflow.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.everrich.cashflow.entities.Setting;
import com.everrich.cashflow.repository.SettingRepository;

@ExtendWith(MockitoExtension.class)
class SettingsServiceTest {

    @Mock
    private SettingRepository settingRepository;

    @InjectMocks
    private SettingsService settingsService;

    @Test
    void missingBalanceReadsAsZero() {
        when(settingRepository.findById(SettingsService.STARTING_BALANCE_KEY)).thenReturn(Optional.empty());

        assertThat(settingsService.getStartingBalance()).isEqualByComparingTo("0");
    }

    @Test
    void storedBalanceIsParsed() {
        when(settingRepository.findById(SettingsService.STARTING_BALANCE_KEY))
                .thenReturn(Optional.of(new Setting(SettingsService.STARTING_BALANCE_KEY, "1234.5")));

        assertThat(settingsService.getStartingBalance()).isEqualTo(new BigDecimal("1234.50"));
    }

    @Test
    void corruptBalanceIsAnError() {
        when(settingRepository.findById(SettingsService.STARTING_BALANCE_KEY))
                .thenReturn(Optional.of(new Setting(SettingsService.STARTING_BALANCE_KEY, "abc")));

        assertThatThrownBy(() -> settingsService.getStartingBalance()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void setBalanceStoresCanonicalText() {
        when(settingRepository.findById(SettingsService.STARTING_BALANCE_KEY)).thenReturn(Optional.empty());
        when(settingRepository.save(any(Setting.class))).thenAnswer(invocation -> invocation.getArgument(0));

        BigDecimal stored = settingsService.setStartingBalance(new BigDecimal("1E+3"));

        ArgumentCaptor<Setting> captor = ArgumentCaptor.forClass(Setting.class);
        verify(settingRepository).save(captor.capture());
        assertThat(captor.getValue().getValue()).isEqualTo("1000.00");
        assertThat(stored).isEqualTo(new BigDecimal("1000.00"));
    }
}
