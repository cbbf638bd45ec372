package com.escrowswap.domain;

/**
 * A token on one chain. Native assets carry {@link #NATIVE_ADDRESS} as their address.
 */
public record TokenRef(ChainId chainId, String address, int decimals, String symbol) {

    public static final String NATIVE_ADDRESS = "0xEeeeeEeeeEeEeeEeEeEeeEEEeeeeEeeeeeeeEEeE";

    public TokenRef {
        if (chainId == null || address == null || symbol == null) {
            throw new IllegalArgumentException("chainId, address and symbol are required");
        }
        if (decimals < 0 || decimals > 36) {
            throw new IllegalArgumentException("decimals out of range: " + decimals);
        }
    }

    public static TokenRef nativeOn(ChainId chainId, String symbol) {
        return new TokenRef(chainId, NATIVE_ADDRESS, 18, symbol);
    }

    public boolean isNative() {
        return NATIVE_ADDRESS.equalsIgnoreCase(address);
    }

    /** "ARBITRUM:MXNB" style key used in configuration and logs. */
    public String key() {
        return chainId.name() + ":" + symbol;
    }
}
