package com.escrowswap.chain;

import com.escrowswap.domain.ChainId;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Routing table ChainId → ChainClient, built once at startup. Two clients for one chain fail fast.
 */
public class ChainClientRegistry {

    private final Map<ChainId, ChainClient> clientsByChain;

    public ChainClientRegistry(List<? extends ChainClient> clients) {
        Map<ChainId, ChainClient> map = new EnumMap<>(ChainId.class);
        for (ChainClient client : clients) {
            ChainClient previous = map.putIfAbsent(client.chainId(), client);
            if (previous != null) {
                throw new IllegalStateException("Multiple chain clients configured for " + client.chainId());
            }
        }
        this.clientsByChain = map;
    }

    public Optional<ChainClient> find(ChainId chainId) {
        return Optional.ofNullable(clientsByChain.get(chainId));
    }

    public ChainClient require(ChainId chainId) {
        return find(chainId).orElseThrow(() -> new RpcException("No chain client configured for " + chainId));
    }

    public Set<ChainId> chains() {
        return clientsByChain.keySet();
    }
}
