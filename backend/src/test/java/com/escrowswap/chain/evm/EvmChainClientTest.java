package com.escrowswap.chain.evm;

import com.escrowswap.chain.ChainTransaction;
import com.escrowswap.chain.EscrowSigner;
import com.escrowswap.chain.RpcEndpointRotator;
import com.escrowswap.chain.RpcException;
import com.escrowswap.chain.SignedTransfer;
import com.escrowswap.chain.TransactionConfirmation;
import com.escrowswap.common.RetryPolicy;
import com.escrowswap.domain.ChainId;
import com.escrowswap.domain.TokenRef;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.cache.concurrent.ConcurrentMapCache;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvmChainClientTest {

    private static final String KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    private static final String ESCROW = "0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266";
    private static final String WALLET = "0x1A87f12aC07E9746e9B053B8D7EF1d45270D693f";
    private static final String MXNB = "0xF197FFC28c23E0309B5559e7a166f2c6164C80aA";
    private static final String HASH = "0x" + "ab".repeat(32);

    @Mock
    private EvmRpcClient evmRpcClient;

    private EvmChainClient client;

    @BeforeEach
    void setUp() {
        client = new EvmChainClient(
                ChainId.ARBITRUM,
                new RpcEndpointRotator(ChainId.ARBITRUM, List.of("https://a.example", "https://b.example"), new RetryPolicy(0L, 0, 3)),
                evmRpcClient,
                new ObjectMapper(),
                RateLimiter.ofDefaults("test"),
                100L,
                new ConcurrentMapCache("latestBlockCache"));
    }

    @Test
    @DisplayName("native balance is parsed from the hex result")
    void getBalance_parsesHex() {
        when(evmRpcClient.call(anyString(), eq("eth_getBalance"), any()))
                .thenReturn(Mono.just(result("\"0x1bc16d674ec80000\"")));

        assertThat(client.getBalance(WALLET)).isEqualTo(new BigInteger("2000000000000000000"));
    }

    @Test
    @DisplayName("token balance is an eth_call of balanceOf on the token contract")
    @SuppressWarnings("unchecked")
    void readBalance_tokenUsesBalanceOf() {
        when(evmRpcClient.call(anyString(), eq("eth_call"), any()))
                .thenReturn(Mono.just(result("\"0x00000000000000000000000000000000000000000000000000000000004c4b40\"")));

        BigInteger balance = client.readBalance(new TokenRef(ChainId.ARBITRUM, MXNB, 6, "MXNB"), WALLET);

        assertThat(balance).isEqualTo(BigInteger.valueOf(5_000_000L));
        ArgumentCaptor<Object> params = ArgumentCaptor.forClass(Object.class);
        verify(evmRpcClient).call(anyString(), eq("eth_call"), params.capture());
        Map<String, Object> call = (Map<String, Object>) ((List<Object>) params.getValue()).get(0);
        assertThat(call.get("to")).isEqualTo(MXNB);
        assertThat((String) call.get("data")).startsWith("0x70a08231");
    }

    @Test
    @DisplayName("a failed read is retried on the next endpoint")
    void read_retriesOnNextEndpoint() {
        when(evmRpcClient.call(eq("https://a.example"), eq("eth_getBalance"), any()))
                .thenReturn(Mono.error(new RpcException("HTTP 503")));
        when(evmRpcClient.call(eq("https://b.example"), eq("eth_getBalance"), any()))
                .thenReturn(Mono.just(result("\"0x10\"")));

        assertThat(client.getBalance(WALLET)).isEqualTo(BigInteger.valueOf(16));
    }

    @Test
    @DisplayName("an RPC error on every attempt surfaces as RpcException")
    void read_errorOnEveryAttempt_throws() {
        when(evmRpcClient.call(anyString(), eq("eth_getBalance"), any()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"header not found\"}}"));

        assertThatThrownBy(() -> client.getBalance(WALLET))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("after 3 attempts")
                .hasMessageContaining("header not found");
        verify(evmRpcClient, times(3)).call(anyString(), eq("eth_getBalance"), any());
    }

    @Test
    void getConfirmation_noReceipt_isUnknown() {
        when(evmRpcClient.call(anyString(), eq("eth_getTransactionReceipt"), any()))
                .thenReturn(Mono.just(result("null")));

        assertThat(client.getConfirmation(HASH).state()).isEqualTo(TransactionConfirmation.State.UNKNOWN);
    }

    @Test
    void getConfirmation_revertedReceipt() {
        when(evmRpcClient.call(anyString(), eq("eth_getTransactionReceipt"), any()))
                .thenReturn(Mono.just(result("{\"status\":\"0x0\",\"blockNumber\":\"0x10\"}")));

        assertThat(client.getConfirmation(HASH).state()).isEqualTo(TransactionConfirmation.State.REVERTED);
    }

    @Test
    @DisplayName("confirmations count the inclusion block; latest block is cached")
    void getConfirmation_countsConfirmations() {
        when(evmRpcClient.call(anyString(), eq("eth_getTransactionReceipt"), any()))
                .thenReturn(Mono.just(result("{\"status\":\"0x1\",\"blockNumber\":\"0x10\"}")));
        when(evmRpcClient.call(anyString(), eq("eth_blockNumber"), any()))
                .thenReturn(Mono.just(result("\"0x12\"")));

        TransactionConfirmation first = client.getConfirmation(HASH);
        TransactionConfirmation second = client.getConfirmation(HASH);

        assertThat(first.state()).isEqualTo(TransactionConfirmation.State.SUCCEEDED);
        assertThat(first.confirmations()).isEqualTo(3L);
        assertThat(second.confirmations()).isEqualTo(3L);
        verify(evmRpcClient, times(1)).call(anyString(), eq("eth_blockNumber"), any());
    }

    @Test
    @DisplayName("token transfer is signed locally and broadcast once; the hash is known before sending")
    void submitTransfer_token() {
        stubNonceAndGasPrice();
        when(evmRpcClient.call(anyString(), eq("eth_estimateGas"), any()))
                .thenReturn(Mono.just(result("\"0xc350\"")));
        stubNodeAcceptsBroadcast();

        SignedTransfer signed = client.signTransfer(MXNB, WALLET, BigInteger.valueOf(4_975_000L), EscrowSigner.create(ESCROW, KEY));
        String hash = client.broadcast(signed);

        assertThat(signed.nonce()).isEqualTo(BigInteger.valueOf(7));
        assertThat(signed.hash()).isEqualTo(keccak(signed.rawTransaction()));
        assertThat(hash).isEqualTo(signed.hash());
        verify(evmRpcClient, times(1)).call(anyString(), eq("eth_sendRawTransaction"), any());
    }

    @Test
    @DisplayName("gas estimation failure falls back to the fixed gas limit")
    void submitTransfer_estimateFails_usesFallback() {
        stubNonceAndGasPrice();
        when(evmRpcClient.call(anyString(), eq("eth_estimateGas"), any()))
                .thenReturn(Mono.error(new RpcException("execution reverted")));
        stubNodeAcceptsBroadcast();

        String hash = client.submitTransfer(TokenRef.NATIVE_ADDRESS, WALLET, BigInteger.TEN, EscrowSigner.create(ESCROW, KEY));

        assertThat(hash).matches("0x[0-9a-f]{64}");
    }

    @Test
    @DisplayName("re-sending a transaction the node already holds counts as sent")
    void broadcast_alreadyKnown_returnsHash() {
        SignedTransfer signed = new SignedTransfer(HASH, "0xf86b07", BigInteger.valueOf(7));
        when(evmRpcClient.call(anyString(), eq("eth_sendRawTransaction"), any()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"already known\"}}"));

        assertThat(client.broadcast(signed)).isEqualTo(HASH);
    }

    @Test
    @DisplayName("a transport failure during broadcast is not mistaken for a node answer")
    void broadcast_transportFailure_isNotNodeError() {
        SignedTransfer signed = new SignedTransfer(HASH, "0xf86b07", BigInteger.valueOf(7));
        when(evmRpcClient.call(anyString(), eq("eth_sendRawTransaction"), any()))
                .thenReturn(Mono.error(new IllegalStateException("read timeout")));

        assertThatThrownBy(() -> client.broadcast(signed))
                .isInstanceOfSatisfying(RpcException.class, e -> assertThat(e.isNodeError()).isFalse());
        verify(evmRpcClient, times(1)).call(anyString(), eq("eth_sendRawTransaction"), any());
    }

    @Test
    void getTransaction_parsesFields() {
        when(evmRpcClient.call(anyString(), eq("eth_getTransactionByHash"), any()))
                .thenReturn(Mono.just(result("{\"hash\":\"" + HASH + "\",\"from\":\"" + WALLET.toLowerCase()
                        + "\",\"to\":\"" + MXNB.toLowerCase() + "\",\"value\":\"0x0\",\"input\":\"0xa9059cbb\"}")));

        ChainTransaction tx = client.getTransaction(HASH).orElseThrow();

        assertThat(tx.from()).isEqualToIgnoringCase(WALLET);
        assertThat(tx.to()).isEqualToIgnoringCase(MXNB);
        assertThat(tx.value()).isZero();
        assertThat(tx.input()).isEqualTo("0xa9059cbb");
    }

    @Test
    void getTransaction_unknownHash_isEmpty() {
        when(evmRpcClient.call(anyString(), eq("eth_getTransactionByHash"), any()))
                .thenReturn(Mono.just(result("null")));

        assertThat(client.getTransaction(HASH)).isEmpty();
    }

    @Test
    @DisplayName("a rejected broadcast is not retried")
    void submitTransfer_broadcastFails_notRetried() {
        stubNonceAndGasPrice();
        when(evmRpcClient.call(anyString(), eq("eth_estimateGas"), any()))
                .thenReturn(Mono.just(result("\"0x5208\"")));
        when(evmRpcClient.call(anyString(), eq("eth_sendRawTransaction"), any()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"insufficient funds for gas\"}}"));

        assertThatThrownBy(() -> client.submitTransfer(TokenRef.NATIVE_ADDRESS, WALLET, BigInteger.TEN,
                EscrowSigner.create(ESCROW, KEY)))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("insufficient funds");
        verify(evmRpcClient, times(1)).call(anyString(), eq("eth_sendRawTransaction"), any());
    }

    @Test
    void submitTransfer_withoutKey_throwsBeforeAnyCall() {
        assertThatThrownBy(() -> client.submitTransfer(MXNB, WALLET, BigInteger.ONE, EscrowSigner.withoutKey(ESCROW)))
                .isInstanceOf(RpcException.class);
        verify(evmRpcClient, never()).call(anyString(), anyString(), any());
    }

    private void stubNonceAndGasPrice() {
        when(evmRpcClient.call(anyString(), eq("eth_getTransactionCount"), any()))
                .thenReturn(Mono.just(result("\"0x7\"")));
        when(evmRpcClient.call(anyString(), eq("eth_gasPrice"), any()))
                .thenReturn(Mono.just(result("\"0x3b9aca00\"")));
    }

    @SuppressWarnings("unchecked")
    private void stubNodeAcceptsBroadcast() {
        when(evmRpcClient.call(anyString(), eq("eth_sendRawTransaction"), any())).thenAnswer(invocation -> {
            String raw = (String) ((List<Object>) invocation.getArgument(2)).get(0);
            return Mono.just(result("\"" + keccak(raw) + "\""));
        });
    }

    private static String keccak(String rawTransaction) {
        return Numeric.toHexString(Hash.sha3(Numeric.hexStringToByteArray(rawTransaction)));
    }

    private static String result(String rawJson) {
        return "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":" + rawJson + "}";
    }
}
