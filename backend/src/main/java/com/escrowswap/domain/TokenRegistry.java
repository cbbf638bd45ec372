package com.escrowswap.domain;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Static table of the tokens the escrow handles, per chain.
 */
@Component
public class TokenRegistry {

    private static final List<TokenRef> TOKENS = List.of(
            new TokenRef(ChainId.BASE, "0xa411c9Aa00E020e4f88Bc19996d29c5B7ADB4ACf", 18, "XOC"),
            new TokenRef(ChainId.ARBITRUM, "0xF197FFC28c23E0309B5559e7a166f2c6164C80aA", 6, "MXNB"),
            new TokenRef(ChainId.MANTLE, "0x201EBa5CC46D216Ce6DC03F6a759e8E766e956aE", 6, "USDT"),
            new TokenRef(ChainId.ZKSYNC_ERA, "0x493257fD37EDB34451f62EDf8D2a0C418852bA4C", 6, "USDT"),
            new TokenRef(ChainId.CELO, "0x765DE816845861e75A25fCA122bb6898B8B1282a", 18, "cUSD"),
            TokenRef.nativeOn(ChainId.BASE, "ETH"),
            TokenRef.nativeOn(ChainId.ARBITRUM, "ETH"),
            TokenRef.nativeOn(ChainId.MANTLE, "MNT"),
            TokenRef.nativeOn(ChainId.ZKSYNC_ERA, "ETH"),
            TokenRef.nativeOn(ChainId.CELO, "CELO")
    );

    public List<TokenRef> all() {
        return TOKENS;
    }

    /** Symbol match is case-insensitive ("cusd" finds cUSD). */
    public Optional<TokenRef> find(ChainId chainId, String symbol) {
        if (chainId == null || symbol == null) {
            return Optional.empty();
        }
        String s = symbol.trim().toUpperCase(Locale.ROOT);
        return TOKENS.stream()
                .filter(t -> t.chainId() == chainId && t.symbol().toUpperCase(Locale.ROOT).equals(s))
                .findFirst();
    }

    public TokenRef nativeToken(ChainId chainId) {
        return TOKENS.stream()
                .filter(t -> t.chainId() == chainId && t.isNative())
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No native token registered for " + chainId));
    }

    public List<TokenRef> tokensOn(ChainId chainId) {
        return TOKENS.stream().filter(t -> t.chainId() == chainId).toList();
    }

    /** Contract tokens only; the native sentinel is shared by every chain. */
    public List<TokenRef> contractTokens() {
        return TOKENS.stream().filter(t -> !t.isNative()).toList();
    }
}
