package com.escrowswap.api.controller;

import com.escrowswap.chain.ChainClient;
import com.escrowswap.chain.ChainClientRegistry;
import com.escrowswap.domain.ChainId;
import com.escrowswap.domain.PendingTransactionStatus;
import com.escrowswap.domain.TokenRef;
import com.escrowswap.swap.tx.PendingTransactionTracker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigInteger;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@SpringBootTest
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class TransactionControllerIntegrationTest {

    private static final String WALLET = "0x1A87f12aC07E9746e9B053B8D7EF1d45270D693f";
    private static final String ESCROW = "0x9c77c6fafc1eb0821F1De12972Ef0199C97C6e45";
    private static final String HASH = "0x" + "5e".repeat(32);

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    PendingTransactionTracker pendingTransactionTracker;

    @MockBean
    ChainClientRegistry chainClientRegistry;

    @Test
    @DisplayName("GET /transactions/{id} returns what a signer needs")
    void get_returnsTransaction() {
        String id = pendingTransactionTracker.create(ESCROW, "0.25", null, WALLET, ChainId.BASE);

        webTestClient.get()
                .uri("/api/v1/transactions/{id}", id)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo(id)
                .jsonPath("$.to").isEqualTo(ESCROW)
                .jsonPath("$.value").isEqualTo("250000000000000000")
                .jsonPath("$.status").isEqualTo("PENDING")
                .jsonPath("$.chain").isEqualTo("BASE")
                .jsonPath("$.chainId").isEqualTo(8453)
                .jsonPath("$.chainResolution").isEqualTo("EXPLICIT")
                .jsonPath("$.requiresSignature").isEqualTo(true)
                .jsonPath("$.dataType").isEqualTo("NATIVE_TRANSFER");
    }

    @Test
    void get_unknownId_is404() {
        webTestClient.get()
                .uri("/api/v1/transactions/tx-0-0")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND");
    }

    @Test
    void list_filtersByStatus() {
        String id = pendingTransactionTracker.create(ESCROW, "1", null, WALLET, ChainId.CELO);
        pendingTransactionTracker.updateStatus(id, PendingTransactionStatus.SIGNED, HASH);

        webTestClient.get()
                .uri("/api/v1/transactions?status=signed")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[?(@.id == '" + id + "')].hash").isEqualTo(HASH)
                .jsonPath("$[?(@.status != 'SIGNED')]").isEmpty();
    }

    @Test
    void list_unknownStatus_is400() {
        webTestClient.get()
                .uri("/api/v1/transactions?status=lost")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_STATUS");
    }

    @Test
    @DisplayName("signer status report moves the swap's source leg onto the broadcast hash")
    void updateStatus_linksSwapSourceLeg() {
        ChainClient mantle = mock(ChainClient.class);
        ChainClient zksync = mock(ChainClient.class);
        when(chainClientRegistry.require(ChainId.MANTLE)).thenReturn(mantle);
        when(chainClientRegistry.require(ChainId.ZKSYNC_ERA)).thenReturn(zksync);
        when(mantle.readBalance(any(TokenRef.class), eq(WALLET))).thenReturn(BigInteger.valueOf(10_000_000L));
        when(zksync.readBalance(any(TokenRef.class), eq(ESCROW))).thenReturn(BigInteger.valueOf(100_000_000L));

        @SuppressWarnings("unchecked")
        Map<String, Object> created = webTestClient.post()
                .uri("/api/v1/swaps")
                .header("X-Wallet-Address", WALLET)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(SwapControllerIntegrationTest.request("2"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(Map.class)
                .returnResult()
                .getResponseBody();
        assertThat(created).isNotNull();

        webTestClient.post()
                .uri("/api/v1/transactions/{id}/status", created.get("pendingTransactionId"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "SIGNED", "hash", HASH))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("SIGNED")
                .jsonPath("$.hash").isEqualTo(HASH);

        webTestClient.get()
                .uri("/api/v1/swaps/receipt?swapId={id}", created.get("swapId"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.source.hash").isEqualTo(HASH)
                .jsonPath("$.source.explorerUrl").isEqualTo("https://mantlescan.xyz/tx/" + HASH)
                .jsonPath("$.status").isEqualTo("PENDING");
    }

    @Test
    @DisplayName("a terminal status cannot be changed: 409")
    void updateStatus_terminal_is409() {
        String id = pendingTransactionTracker.create(ESCROW, "1", null, WALLET, ChainId.BASE);
        pendingTransactionTracker.updateStatus(id, PendingTransactionStatus.COMPLETED, HASH);

        webTestClient.post()
                .uri("/api/v1/transactions/{id}/status", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "REJECTED"))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("CONFLICT");
    }

    @Test
    void updateStatus_badHash_is400() {
        String id = pendingTransactionTracker.create(ESCROW, "1", null, WALLET, ChainId.BASE);

        webTestClient.post()
                .uri("/api/v1/transactions/{id}/status", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "SIGNED", "hash", "0x1234"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_HASH");
    }

    @Test
    void updateStatus_unknownId_is404() {
        webTestClient.post()
                .uri("/api/v1/transactions/tx-0-0/status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "SIGNED"))
                .exchange()
                .expectStatus().isNotFound();
    }
}
