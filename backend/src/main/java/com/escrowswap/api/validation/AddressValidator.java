package com.escrowswap.api.validation;

import com.escrowswap.common.EvmAddresses;
import com.escrowswap.domain.ChainId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates wallet addresses and chain names coming from request headers and query parameters.
 */
@Component
public class AddressValidator {

    public boolean isValidAddress(String address) {
        return EvmAddresses.isValid(address);
    }

    /**
     * Comma-separated chain names. Empty result for null/blank input; empty Optional when any name is unknown.
     */
    public Optional<List<ChainId>> parseChains(String chains) {
        List<ChainId> result = new ArrayList<>();
        if (chains == null || chains.isBlank()) {
            return Optional.of(result);
        }
        for (String name : chains.split(",")) {
            Optional<ChainId> chain = ChainId.fromName(name);
            if (chain.isEmpty()) {
                return Optional.empty();
            }
            result.add(chain.get());
        }
        return Optional.of(result);
    }
}
