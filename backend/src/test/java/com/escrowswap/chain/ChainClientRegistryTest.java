package com.escrowswap.chain;

import com.escrowswap.domain.ChainId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChainClientRegistryTest {

    @Test
    void find_routesByChain() {
        ChainClient base = client(ChainId.BASE);
        ChainClient celo = client(ChainId.CELO);
        ChainClientRegistry registry = new ChainClientRegistry(List.of(base, celo));

        assertThat(registry.find(ChainId.BASE)).containsSame(base);
        assertThat(registry.require(ChainId.CELO)).isSameAs(celo);
        assertThat(registry.find(ChainId.MANTLE)).isEmpty();
        assertThat(registry.chains()).containsExactlyInAnyOrder(ChainId.BASE, ChainId.CELO);
    }

    @Test
    void require_missingChain_throwsRpcException() {
        ChainClientRegistry registry = new ChainClientRegistry(List.of());
        assertThatThrownBy(() -> registry.require(ChainId.ARBITRUM))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("ARBITRUM");
    }

    @Test
    void constructor_duplicateChain_failsFast() {
        assertThatThrownBy(() -> new ChainClientRegistry(List.of(client(ChainId.BASE), client(ChainId.BASE))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("BASE");
    }

    private static ChainClient client(ChainId chainId) {
        ChainClient client = mock(ChainClient.class);
        when(client.chainId()).thenReturn(chainId);
        return client;
    }
}
