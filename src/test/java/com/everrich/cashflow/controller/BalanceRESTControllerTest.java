package com.everrich.cashflow.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.everrich.cashflow.service.SettingsService;

@WebMvcTest(BalanceRESTController.class)
class BalanceRESTControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SettingsService settingsService;

    @Test
    void returnsStartingBalance() throws Exception {
        when(settingsService.getStartingBalance()).thenReturn(new BigDecimal("250.75"));

        mockMvc.perform(get("/api/balance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(250.75));
    }

    @Test
    void updatesStartingBalance() throws Exception {
        when(settingsService.setStartingBalance(new BigDecimal("1000.5"))).thenReturn(new BigDecimal("1000.50"));

        mockMvc.perform(put("/api/balance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"balance\":1000.5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.balance").value(1000.50));
    }

    @Test
    void missingBalanceIsBadRequest() throws Exception {
        mockMvc.perform(put("/api/balance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(put("/api/balance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"balance\":\"lots\"}"))
                .andExpect(status().isBadRequest());
    }
}
