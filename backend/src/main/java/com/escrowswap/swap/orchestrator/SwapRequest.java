package com.escrowswap.swap.orchestrator;

import com.escrowswap.domain.ChainId;

/**
 * Swap intent. {@code recipientAddress} defaults to the sender when null.
 */
public record SwapRequest(
        ChainId sourceChain,
        String sourceToken,
        ChainId targetChain,
        String targetToken,
        String amount,
        String recipientAddress
) {
}
