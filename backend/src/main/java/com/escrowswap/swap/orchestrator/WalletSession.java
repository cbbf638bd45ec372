package com.escrowswap.swap.orchestrator;

import com.escrowswap.domain.ChainId;

/**
 * Caller's connected wallet. {@code activeChain} is null when the caller did not report one.
 */
public record WalletSession(String address, ChainId activeChain) {
}
