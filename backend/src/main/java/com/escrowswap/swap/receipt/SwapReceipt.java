package com.escrowswap.swap.receipt;

import com.escrowswap.domain.SwapStatus;

import java.time.Instant;

/**
 * Rendered swap receipt: both legs, status, status message and a plain-text rendering of all of it.
 */
public record SwapReceipt(
        String swapId,
        SwapStatus status,
        String message,
        ReceiptLeg source,
        ReceiptLeg target,
        Instant timestamp,
        String failureReason,
        String text
) {
}
