package com.escrowswap.domain;

/**
 * Chain chosen for a pending transaction and how it was chosen.
 */
public record ChainResolution(ChainId chainId, Kind kind) {

    public enum Kind {
        /** Caller supplied the chain. */
        EXPLICIT,
        /** Destination matched a known token contract. */
        INFERRED,
        /** Unknown destination; configured default chain used. */
        FALLBACK
    }

    public static ChainResolution explicit(ChainId chainId) {
        return new ChainResolution(chainId, Kind.EXPLICIT);
    }

    public boolean isFallback() {
        return kind == Kind.FALLBACK;
    }
}
