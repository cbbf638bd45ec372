package com.escrowswap.domain;

import java.time.Instant;

/**
 * Unsigned transfer intent awaiting an external signer.
 *
 * @param value integer base units (decimal) or an unchanged 0x hex quantity
 * @param data  0x-prefixed call data, null for plain native transfers
 * @param hash  broadcast hash, null until the signer reports it
 */
public record PendingTransaction(
        String id,
        String to,
        String value,
        String data,
        PendingTransactionStatus status,
        String hash,
        TransactionMetadata metadata,
        Instant createdAt,
        Instant updatedAt
) {

    public PendingTransaction withStatus(PendingTransactionStatus newStatus, String newHash, Instant at) {
        return new PendingTransaction(id, to, value, data, newStatus, newHash != null ? newHash : hash, metadata,
                createdAt, at);
    }
}
