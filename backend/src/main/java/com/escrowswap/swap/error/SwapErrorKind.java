package com.escrowswap.swap.error;

/**
 * Closed set of swap failure kinds. Callers switch over it exhaustively.
 */
public enum SwapErrorKind {
    /** Malformed or out-of-range amount; user-correctable. */
    INVALID_AMOUNT,
    INVALID_ADDRESS,
    /** Sender cannot fund the source leg. */
    INSUFFICIENT_BALANCE,
    /** Escrow cannot fund the target leg: operator liquidity shortfall. */
    INSUFFICIENT_ESCROW_BALANCE,
    UNSUPPORTED_PAIR,
    /** The chain rejected a submitted transaction. */
    TRANSACTION_FAILED,
    /** Caller's active network differs from the one a single-chain operation requires. */
    WRONG_NETWORK,
    NOT_FOUND,
    /** A balance read could not be completed. */
    CHAIN_UNAVAILABLE
}
