package com.escrowswap.api.dto;

public record InitiateSwapResponse(
        String swapId,
        String pendingTransactionId,
        String status,
        String targetAmount,
        String targetTxHash,
        String summary
) {
}
