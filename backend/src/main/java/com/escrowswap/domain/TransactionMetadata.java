package com.escrowswap.domain;

/**
 * Signing context attached to a pending transaction.
 */
public record TransactionMetadata(
        WalletSource source,
        String walletAddress,
        boolean requiresSignature,
        TransactionDataType dataType,
        ChainId chain,
        ChainResolution.Kind chainResolution
) {
}
