package com.escrowswap.swap.orchestrator;

/**
 * Liquidity deposit created for the caller to sign.
 */
public record EscrowDeposit(String transactionId, String summary) {
}
