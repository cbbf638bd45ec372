package com.escrowswap.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ChainIdTest {

    @Test
    void numericIds() {
        assertThat(ChainId.BASE.numericId()).isEqualTo(8453L);
        assertThat(ChainId.ARBITRUM.numericId()).isEqualTo(42161L);
        assertThat(ChainId.MANTLE.numericId()).isEqualTo(5000L);
        assertThat(ChainId.ZKSYNC_ERA.numericId()).isEqualTo(324L);
        assertThat(ChainId.CELO.numericId()).isEqualTo(42220L);
    }

    @Test
    void fromName_caseAndDashInsensitive() {
        assertThat(ChainId.fromName("zksync-era")).contains(ChainId.ZKSYNC_ERA);
        assertThat(ChainId.fromName(" base ")).contains(ChainId.BASE);
        assertThat(ChainId.fromName("ethereum")).isEmpty();
        assertThat(ChainId.fromName(null)).isEmpty();
    }

    @Test
    void fromNumericId() {
        assertThat(ChainId.fromNumericId(42220L)).contains(ChainId.CELO);
        assertThat(ChainId.fromNumericId(1L)).isEmpty();
    }

    @Test
    void explorerLink_appendsHash() {
        assertThat(ChainId.ARBITRUM.explorerLink("0xabc")).endsWith("/tx/0xabc");
    }
}
