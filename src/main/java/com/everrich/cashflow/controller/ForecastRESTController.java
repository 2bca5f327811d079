package com.everrich.cashflow.controller;

import java.util.List;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.everrich.cashflow.forecast.ForecastDay;
import com.everrich.cashflow.forecast.LowestPoint;
import com.everrich.cashflow.service.FinanceService;

@RestController
@RequestMapping("/api/forecast")
public class ForecastRESTController {

    private final FinanceService financeService;

    public ForecastRESTController(FinanceService financeService) {
        this.financeService = financeService;
    }

    // Daily balances from today using the recorded starting balance
    @GetMapping
    public List<ForecastDay> getForecast(@RequestParam(value = "days", required = false) Integer days) {
        return financeService.calculateForecast(days);
    }

    @GetMapping("/lowest")
    public LowestPoint getLowestPoint(@RequestParam(value = "days", required = false) Integer days) {
        return financeService.getLowestPoint(days);
    }
}
