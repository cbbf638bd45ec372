package com.escrowswap.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-chain RPC endpoints. Key = ChainId name (BASE, ARBITRUM, ...). Chains without URLs get no client and
 * every operation on them reports the chain as unavailable.
 */
@ConfigurationProperties(prefix = "escrowswap.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainNetworkProperties {

    private Map<String, NetworkEntry> network = new HashMap<>();

    public void setNetwork(Map<String, NetworkEntry> network) {
        this.network = network != null ? network : new HashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class NetworkEntry {

        private List<String> urls = new ArrayList<>();

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }
}
