package com.escrowswap.domain;

/**
 * Application event: the external signer reported a new status (and possibly the broadcast hash)
 * for a pending transaction. Consumed by the swap ledger to follow the source leg.
 */
public record PendingTransactionUpdatedEvent(PendingTransaction transaction) {
}
