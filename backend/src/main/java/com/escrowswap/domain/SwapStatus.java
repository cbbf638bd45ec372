package com.escrowswap.domain;

/**
 * Swap lifecycle: PENDING until the payout leg is sent, then COMPLETED; FAILED is terminal.
 */
public enum SwapStatus {
    PENDING,
    COMPLETED,
    FAILED
}
