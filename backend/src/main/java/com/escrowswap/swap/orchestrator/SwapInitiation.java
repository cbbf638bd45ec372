package com.escrowswap.swap.orchestrator;

import com.escrowswap.domain.SwapStatus;

/**
 * Result of a recorded swap: ids to follow it, the fee-adjusted output and a human-readable summary.
 */
public record SwapInitiation(
        String swapId,
        String pendingTransactionId,
        SwapStatus status,
        String targetAmount,
        String targetTxHash,
        String summary
) {
}
