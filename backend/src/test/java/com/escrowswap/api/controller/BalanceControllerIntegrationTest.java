package com.escrowswap.api.controller;

import com.escrowswap.chain.ChainClient;
import com.escrowswap.chain.ChainClientRegistry;
import com.escrowswap.chain.RpcException;
import com.escrowswap.domain.ChainId;
import com.escrowswap.domain.TokenRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigInteger;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@SpringBootTest
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class BalanceControllerIntegrationTest {

    private static final String WALLET = "0x1A87f12aC07E9746e9B053B8D7EF1d45270D693f";

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    ChainClientRegistry chainClientRegistry;

    @Test
    @DisplayName("balances across requested chains; unreadable entries are marked unavailable")
    void balances_selectedChains() {
        ChainClient arbitrum = mock(ChainClient.class);
        when(chainClientRegistry.require(ChainId.ARBITRUM)).thenReturn(arbitrum);
        when(chainClientRegistry.require(ChainId.CELO)).thenThrow(new RpcException("No chain client configured for CELO"));
        when(arbitrum.readBalance(any(TokenRef.class), eq(WALLET))).thenReturn(BigInteger.valueOf(2_000_000L));

        webTestClient.get()
                .uri("/api/v1/balances/{address}?chains=arbitrum,celo", WALLET)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.address").isEqualTo(WALLET)
                .jsonPath("$.balances.length()").isEqualTo(4)
                .jsonPath("$.balances[?(@.symbol == 'MXNB')].amount").isEqualTo("2.0")
                .jsonPath("$.balances[?(@.symbol == 'cUSD')].available").isEqualTo(false);
    }

    @Test
    void balances_defaultsToConfiguredChains() {
        ChainClient base = mock(ChainClient.class);
        when(chainClientRegistry.chains()).thenReturn(Set.of(ChainId.BASE));
        when(chainClientRegistry.require(ChainId.BASE)).thenReturn(base);
        when(base.readBalance(any(TokenRef.class), eq(WALLET))).thenReturn(BigInteger.ZERO);

        webTestClient.get()
                .uri("/api/v1/balances/{address}", WALLET)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.balances.length()").isEqualTo(2)
                .jsonPath("$.balances[0].chain").isEqualTo("BASE");
    }

    @Test
    void balances_invalidAddress_is400() {
        webTestClient.get()
                .uri("/api/v1/balances/0x123")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS");
    }

    @Test
    void balances_unknownChain_is400() {
        webTestClient.get()
                .uri("/api/v1/balances/{address}?chains=base,solana", WALLET)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_NETWORK");
    }
}
