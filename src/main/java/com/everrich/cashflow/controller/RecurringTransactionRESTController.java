package com.everrich.cashflow.controller;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import com.everrich.cashflow.dto.ActiveRequest;
import com.everrich.cashflow.dto.RecurringTransactionRequest;
import com.everrich.cashflow.entities.RecurringTransaction;
import com.everrich.cashflow.service.RecurringTransactionService;

@RestController
@RequestMapping("/api/recurring")
public class RecurringTransactionRESTController {

    private static final Logger log = LoggerFactory.getLogger(RecurringTransactionRESTController.class);

    private final RecurringTransactionService recurringTransactionService;

    public RecurringTransactionRESTController(RecurringTransactionService recurringTransactionService) {
        this.recurringTransactionService = recurringTransactionService;
    }

    @PostMapping
    public ResponseEntity<RecurringTransaction> create(@RequestBody RecurringTransactionRequest request) {
        log.info("REST Endpoint Call for Create Recurring Transaction");
        return new ResponseEntity<>(recurringTransactionService.create(request), HttpStatus.CREATED);
    }

    @GetMapping
    public List<RecurringTransaction> list() {
        return recurringTransactionService.findAll();
    }

    @PutMapping("/{id}")
    public RecurringTransaction update(@PathVariable Long id, @RequestBody RecurringTransactionRequest request) {
        return recurringTransactionService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable Long id) {
        recurringTransactionService.delete(id);
        return ResponseEntity.ok(Map.of("status", "success"));
    }

    @PutMapping("/{id}/active")
    public ResponseEntity<Map<String, Object>> setActive(@PathVariable Long id, @RequestBody ActiveRequest request) {
        if (request == null || request.active() == null) {
            return ResponseEntity.badRequest().body(Map.of(
                "error", "Missing 'active' field in request body"
            ));
        }
        recurringTransactionService.setActive(id, request.active());
        return ResponseEntity.ok(Map.of(
            "status", "success",
            "active", request.active()
        ));
    }
}
