package com.escrowswap.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported EVM network with its numeric chain id and block-explorer transaction URL prefix.
 */
public enum ChainId {
    BASE(8453L, "Base", "https://basescan.org/tx/"),
    ARBITRUM(42161L, "Arbitrum", "https://arbiscan.io/tx/"),
    MANTLE(5000L, "Mantle", "https://mantlescan.xyz/tx/"),
    ZKSYNC_ERA(324L, "zkSync Era", "https://era.zksync.network/tx/"),
    CELO(42220L, "Celo", "https://celoscan.io/tx/");

    private final long numericId;
    private final String displayName;
    private final String explorerTxUrl;

    ChainId(long numericId, String displayName, String explorerTxUrl) {
        this.numericId = numericId;
        this.displayName = displayName;
        this.explorerTxUrl = explorerTxUrl;
    }

    public long numericId() {
        return numericId;
    }

    public String displayName() {
        return displayName;
    }

    public String explorerLink(String txHash) {
        return explorerTxUrl + txHash;
    }

    /** Case-insensitive lookup by enum name; "zksync-era" and "zksync_era" both match. */
    public static Optional<ChainId> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(c -> c.name().equals(normalized)).findFirst();
    }

    public static Optional<ChainId> fromNumericId(long numericId) {
        return Arrays.stream(values()).filter(c -> c.numericId == numericId).findFirst();
    }
}
