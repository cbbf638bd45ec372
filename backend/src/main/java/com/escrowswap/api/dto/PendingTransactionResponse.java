package com.escrowswap.api.dto;

import com.escrowswap.domain.PendingTransaction;

import java.time.Instant;

/**
 * Pending transaction as returned to signers: everything needed to build and sign it.
 */
public record PendingTransactionResponse(
        String id,
        String to,
        String value,
        String data,
        String status,
        String hash,
        String chain,
        Long chainId,
        String chainResolution,
        String source,
        String walletAddress,
        boolean requiresSignature,
        String dataType,
        Instant createdAt,
        Instant updatedAt
) {

    public static PendingTransactionResponse from(PendingTransaction tx) {
        return new PendingTransactionResponse(
                tx.id(),
                tx.to(),
                tx.value(),
                tx.data(),
                tx.status().name(),
                tx.hash(),
                tx.metadata().chain().name(),
                tx.metadata().chain().numericId(),
                tx.metadata().chainResolution().name(),
                tx.metadata().source().name(),
                tx.metadata().walletAddress(),
                tx.metadata().requiresSignature(),
                tx.metadata().dataType().name(),
                tx.createdAt(),
                tx.updatedAt());
    }
}
