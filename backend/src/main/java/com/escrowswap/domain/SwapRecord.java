package com.escrowswap.domain;

import java.time.Instant;

/**
 * One swap attempt. Immutable; the ledger replaces the stored instance on every status change.
 *
 * @param pendingTransactionId the sender's source-leg transfer; stays fixed for the life of the swap
 * @param sourceTxHash         pending-transaction id until the signer reports the broadcast hash
 * @param targetTxHash         payout hash, null until the payout leg is signed
 */
public record SwapRecord(
        String swapId,
        ChainId sourceChain,
        ChainId targetChain,
        String sourceToken,
        String targetToken,
        String sourceAmount,
        String targetAmount,
        String senderAddress,
        String recipientAddress,
        String pendingTransactionId,
        String sourceTxHash,
        String targetTxHash,
        SwapStatus status,
        Instant timestamp,
        String failureReason
) {

    public SwapRecord withStatus(SwapStatus newStatus) {
        return new SwapRecord(swapId, sourceChain, targetChain, sourceToken, targetToken, sourceAmount, targetAmount,
                senderAddress, recipientAddress, pendingTransactionId, sourceTxHash, targetTxHash, newStatus, timestamp, failureReason);
    }

    public SwapRecord withSourceTxHash(String hash) {
        return new SwapRecord(swapId, sourceChain, targetChain, sourceToken, targetToken, sourceAmount, targetAmount,
                senderAddress, recipientAddress, pendingTransactionId, hash, targetTxHash, status, timestamp, failureReason);
    }

    public SwapRecord withTargetTxHash(String hash) {
        return new SwapRecord(swapId, sourceChain, targetChain, sourceToken, targetToken, sourceAmount, targetAmount,
                senderAddress, recipientAddress, pendingTransactionId, sourceTxHash, hash, status, timestamp, failureReason);
    }

    public SwapRecord withFailureReason(String reason) {
        return new SwapRecord(swapId, sourceChain, targetChain, sourceToken, targetToken, sourceAmount, targetAmount,
                senderAddress, recipientAddress, pendingTransactionId, sourceTxHash, targetTxHash, status, timestamp, reason);
    }

    /** Same-chain swaps are paid out synchronously; cross-chain swaps go through settlement. */
    public boolean isCrossChain() {
        return sourceChain != targetChain;
    }
}
