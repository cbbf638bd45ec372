package com.escrowswap.domain;

/**
 * Status reported by the external signer. REJECTED and COMPLETED are terminal.
 */
public enum PendingTransactionStatus {
    PENDING,
    SIGNED,
    REJECTED,
    COMPLETED;

    public boolean isTerminal() {
        return this == REJECTED || this == COMPLETED;
    }
}
