package com.everrich.cashflow.controller;

import java.math.BigDecimal;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import com.everrich.cashflow.dto.BalanceRequest;
import com.everrich.cashflow.service.SettingsService;

@RestController
@RequestMapping("/api/balance")
public class BalanceRESTController {

    private final SettingsService settingsService;

    public BalanceRESTController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    public Map<String, BigDecimal> getBalance() {
        return Map.of("balance", settingsService.getStartingBalance());
    }

    @PutMapping
    public ResponseEntity<Map<String, Object>> setBalance(@RequestBody BalanceRequest request) {
        if (request == null || request.balance() == null) {
            return ResponseEntity.badRequest().body(Map.of(
                "error", "Missing 'balance' field in request body"
            ));
        }
        BigDecimal stored = settingsService.setStartingBalance(request.balance());
        return ResponseEntity.ok(Map.of(
            "status", "success",
            "balance", stored
        ));
    }
}
