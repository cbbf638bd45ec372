package com.escrowswap.chain;

import com.escrowswap.common.RetryPolicy;
import com.escrowswap.domain.ChainId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcEndpointRotatorTest {

    @Test
    void next_cyclesThroughUrls() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(ChainId.BASE,
                List.of("https://mainnet.base.org", "https://base.llamarpc.com"),
                RetryPolicy.defaultPolicy());
        assertThat(rotator.next()).isEqualTo("https://mainnet.base.org");
        assertThat(rotator.next()).isEqualTo("https://base.llamarpc.com");
        assertThat(rotator.next()).isEqualTo("https://mainnet.base.org");
    }

    @Test
    void next_singleUrl_alwaysSame() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(ChainId.CELO, List.of("https://forno.celo.org"), null);
        IntStream.range(0, 5).forEach(i -> assertThat(rotator.next()).isEqualTo("https://forno.celo.org"));
    }

    @Test
    @DisplayName("blank and repeated URLs are dropped")
    void urls_blankAndDuplicatesDropped() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(ChainId.MANTLE,
                Arrays.asList(" https://rpc.mantle.xyz ", "", null, "https://rpc.mantle.xyz", "https://mantle.drpc.org"),
                null);

        assertThat(rotator.urls()).containsExactly("https://rpc.mantle.xyz", "https://mantle.drpc.org");
        assertThat(rotator.chainId()).isEqualTo(ChainId.MANTLE);
    }

    @Test
    void backoffMs_followsPolicy() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(ChainId.MANTLE, List.of("https://rpc.mantle.xyz"),
                new RetryPolicy(100L, 0, 3));
        assertThat(rotator.backoffMs(0)).isEqualTo(100L);
        assertThat(rotator.backoffMs(1)).isEqualTo(200L);
        assertThat(rotator.maxAttempts()).isEqualTo(3);
    }

    @Test
    void constructor_noUsableUrl_throws() {
        assertThatThrownBy(() -> new RpcEndpointRotator(ChainId.ARBITRUM, List.of(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No RPC endpoint configured for ARBITRUM");
        assertThatThrownBy(() -> new RpcEndpointRotator(ChainId.ARBITRUM, List.of(" "), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RpcEndpointRotator(ChainId.ARBITRUM, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
