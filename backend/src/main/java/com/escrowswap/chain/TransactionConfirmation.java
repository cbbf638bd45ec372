package com.escrowswap.chain;

/**
 * On-chain state of a broadcast transaction.
 *
 * @param confirmations blocks since inclusion, counting the inclusion block; 0 when not mined
 */
public record TransactionConfirmation(State state, long confirmations) {

    public enum State {
        /** No receipt yet (not mined, dropped, or unknown hash). */
        UNKNOWN,
        SUCCEEDED,
        REVERTED
    }

    public static TransactionConfirmation unknown() {
        return new TransactionConfirmation(State.UNKNOWN, 0L);
    }
}
