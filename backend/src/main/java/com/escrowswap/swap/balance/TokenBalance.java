package com.escrowswap.swap.balance;

import com.escrowswap.domain.ChainId;

/**
 * One token balance of a wallet. {@code available == false} when the read failed; {@code amount} is then null.
 */
public record TokenBalance(ChainId chain, String symbol, String tokenAddress, String amount, boolean available) {

    public static TokenBalance unavailable(ChainId chain, String symbol, String tokenAddress) {
        return new TokenBalance(chain, symbol, tokenAddress, null, false);
    }
}
