package com.escrowswap.swap.receipt;

import com.escrowswap.domain.ChainId;

/**
 * One side of a swap as shown on a receipt. {@code hash} may be a pending-transaction id; {@code explorerUrl}
 * is only set for real chain hashes.
 */
public record ReceiptLeg(
        ChainId chain,
        String chainName,
        String token,
        String amount,
        String address,
        String hash,
        String explorerUrl
) {
}
