package com.escrowswap.api.controller;

import com.escrowswap.api.dto.ErrorBody;
import com.escrowswap.api.dto.PendingTransactionResponse;
import com.escrowswap.api.dto.TransactionStatusUpdateRequest;
import com.escrowswap.domain.PendingTransactionStatus;
import com.escrowswap.swap.tx.PendingTransactionTracker;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * Pending transactions for external signers: list, fetch, and report status/hash.
 */
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final PendingTransactionTracker pendingTransactionTracker;

    @GetMapping
    public ResponseEntity<?> list(@RequestParam(required = false) String status) {
        PendingTransactionStatus filter = null;
        if (status != null && !status.isBlank()) {
            try {
                filter = PendingTransactionStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_STATUS", "Unknown status: " + status));
            }
        }
        List<PendingTransactionResponse> items = pendingTransactionTracker.list(filter).stream()
                .map(PendingTransactionResponse::from)
                .toList();
        return ResponseEntity.ok(items);
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        return pendingTransactionTracker.findById(id)
                .<ResponseEntity<?>>map(tx -> ResponseEntity.ok(PendingTransactionResponse.from(tx)))
                .orElseGet(() -> notFound(id));
    }

    @PostMapping("/{id}/status")
    public ResponseEntity<?> updateStatus(@PathVariable String id,
                                          @RequestBody @Valid TransactionStatusUpdateRequest request) {
        return pendingTransactionTracker.updateStatus(id, request.status(), request.hash())
                .<ResponseEntity<?>>map(tx -> ResponseEntity.ok(PendingTransactionResponse.from(tx)))
                .orElseGet(() -> notFound(id));
    }

    private static ResponseEntity<?> notFound(String id) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorBody.of("NOT_FOUND", "Transaction " + id + " not found"));
    }
}
