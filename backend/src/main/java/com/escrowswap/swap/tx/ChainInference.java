package com.escrowswap.swap.tx;

import com.escrowswap.domain.ChainId;
import com.escrowswap.domain.ChainResolution;
import com.escrowswap.domain.TokenRef;
import com.escrowswap.domain.TokenRegistry;
import com.escrowswap.swap.config.TrackerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Best-effort chain detection for a transaction destination: a lookup table of known token contracts
 * (lowercase address → chain). Unmatched addresses resolve to the configured default chain, flagged FALLBACK.
 */
@Slf4j
@Component
public class ChainInference {

    private final Map<String, ChainId> chainByAddress;
    private final ChainId defaultChain;

    public ChainInference(TokenRegistry tokenRegistry, TrackerProperties trackerProperties) {
        this.chainByAddress = tokenRegistry.contractTokens().stream()
                .collect(Collectors.toUnmodifiableMap(
                        t -> t.address().toLowerCase(Locale.ROOT),
                        TokenRef::chainId));
        this.defaultChain = trackerProperties.getDefaultChain();
    }

    public ChainResolution resolve(String destination, ChainId explicitChain) {
        if (explicitChain != null) {
            return ChainResolution.explicit(explicitChain);
        }
        ChainId matched = destination == null ? null : chainByAddress.get(destination.toLowerCase(Locale.ROOT));
        if (matched != null) {
            return new ChainResolution(matched, ChainResolution.Kind.INFERRED);
        }
        log.warn("No chain known for destination {}; falling back to {}", destination, defaultChain);
        return new ChainResolution(defaultChain, ChainResolution.Kind.FALLBACK);
    }

    /** The lookup table, for diagnostics. */
    public Map<String, ChainId> table() {
        return chainByAddress;
    }
}
