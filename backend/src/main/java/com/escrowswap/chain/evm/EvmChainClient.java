package com.escrowswap.chain.evm;

import com.escrowswap.chain.ChainClient;
import com.escrowswap.chain.ChainTransaction;
import com.escrowswap.chain.EscrowSigner;
import com.escrowswap.chain.RpcEndpointRotator;
import com.escrowswap.chain.RpcException;
import com.escrowswap.chain.SignedTransfer;
import com.escrowswap.chain.TransactionConfirmation;
import com.escrowswap.common.Amounts;
import com.escrowswap.domain.ChainId;
import com.escrowswap.domain.TokenRef;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ChainClient} over EVM JSON-RPC. Reads rotate endpoints and retry with backoff; a signed transaction is
 * sent once per {@link #broadcast} call, and callers re-send the same bytes rather than signing again. Every call takes a permit from the shared RPC rate limiter first.
 */
@Slf4j
public class EvmChainClient implements ChainClient {

    static final BigInteger FALLBACK_GAS_LIMIT = BigInteger.valueOf(300_000L);

    private final ChainId chainId;
    private final RpcEndpointRotator rotator;
    private final EvmRpcClient rpcClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final long limiterLogThresholdMs;
    private final Cache latestBlockCache;

    public EvmChainClient(ChainId chainId,
                          RpcEndpointRotator rotator,
                          EvmRpcClient rpcClient,
                          ObjectMapper objectMapper,
                          RateLimiter rateLimiter,
                          long limiterLogThresholdMs,
                          Cache latestBlockCache) {
        this.chainId = chainId;
        this.rotator = rotator;
        this.rpcClient = rpcClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.limiterLogThresholdMs = limiterLogThresholdMs;
        this.latestBlockCache = latestBlockCache;
    }

    @Override
    public ChainId chainId() {
        return chainId;
    }

    @Override
    public BigInteger getBalance(String address) {
        JsonNode result = callWithRetry("eth_getBalance", List.of(address, "latest"), false);
        return Amounts.hexToBigInteger(result.asText());
    }

    @Override
    public BigInteger readTokenBalance(String tokenAddress, String address) {
        JsonNode result = callWithRetry("eth_call",
                List.of(Map.of("to", tokenAddress, "data", Erc20Calls.balanceOf(address)), "latest"), false);
        return Amounts.hexToBigInteger(result.asText());
    }

    @Override
    public SignedTransfer signTransfer(String tokenAddressOrNative, String to, BigInteger amount, EscrowSigner signer) {
        if (signer == null || !signer.isAvailable()) {
            throw new RpcException("Escrow signer is not configured");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Transfer amount must be positive");
        }
        boolean nativeTransfer = TokenRef.NATIVE_ADDRESS.equalsIgnoreCase(tokenAddressOrNative);
        String from = signer.address();
        String txTo = nativeTransfer ? to : tokenAddressOrNative;
        BigInteger value = nativeTransfer ? amount : BigInteger.ZERO;
        String data = nativeTransfer ? "" : Erc20Calls.transfer(to, amount);

        BigInteger nonce = Amounts.hexToBigInteger(
                callWithRetry("eth_getTransactionCount", List.of(from, "pending"), false).asText());
        BigInteger gasPrice = Amounts.hexToBigInteger(callWithRetry("eth_gasPrice", List.of(), false).asText());
        BigInteger gasLimit = estimateGas(from, txTo, value, data);

        RawTransaction rawTransaction = nativeTransfer
                ? RawTransaction.createEtherTransaction(nonce, gasPrice, gasLimit, txTo, value)
                : RawTransaction.createTransaction(nonce, gasPrice, gasLimit, txTo, value, data);
        byte[] signed = signer.sign(rawTransaction, chainId.numericId());
        SignedTransfer transfer = new SignedTransfer(Numeric.toHexString(Hash.sha3(signed)), Numeric.toHexString(signed), nonce);
        log.info("Signed transfer on {}: {} base units of {} to {} (nonce {}, gas {}), tx {}",
                chainId, amount, nativeTransfer ? "native" : tokenAddressOrNative, to, nonce, gasLimit, transfer.hash());
        return transfer;
    }

    @Override
    public String broadcast(SignedTransfer transfer) {
        String hash;
        try {
            hash = callOnce(rotator.next(), "eth_sendRawTransaction", List.of(transfer.rawTransaction()), false).asText();
        } catch (RpcException e) {
            if (e.isNodeError() && isAlreadyKnown(e.getMessage())) {
                log.info("Transaction {} already known on {}", transfer.hash(), chainId);
                return transfer.hash();
            }
            throw e;
        }
        if (!transfer.hash().equalsIgnoreCase(hash)) {
            log.warn("Node on {} returned hash {} for transaction {}", chainId, hash, transfer.hash());
        }
        log.info("Broadcast {} on {}", transfer.hash(), chainId);
        return transfer.hash();
    }

    @Override
    public Optional<ChainTransaction> getTransaction(String txHash) {
        JsonNode tx = callWithRetry("eth_getTransactionByHash", List.of(txHash), true);
        if (tx == null || tx.isNull()) {
            return Optional.empty();
        }
        return Optional.of(new ChainTransaction(
                tx.path("hash").asText(txHash),
                tx.path("from").asText(""),
                tx.path("to").isNull() ? "" : tx.path("to").asText(""),
                Amounts.hexToBigInteger(tx.path("value").asText("0x0")),
                tx.path("input").asText("0x")));
    }

    @Override
    public TransactionConfirmation getConfirmation(String txHash) {
        JsonNode receipt = callWithRetry("eth_getTransactionReceipt", List.of(txHash), true);
        if (receipt == null || receipt.isNull()) {
            return TransactionConfirmation.unknown();
        }
        if ("0x0".equals(receipt.path("status").asText())) {
            return new TransactionConfirmation(TransactionConfirmation.State.REVERTED, 0L);
        }
        long included = Amounts.hexToBigInteger(receipt.path("blockNumber").asText()).longValue();
        long confirmations = Math.max(0L, latestBlock() - included + 1);
        return new TransactionConfirmation(TransactionConfirmation.State.SUCCEEDED, confirmations);
    }

    /** eth_estimateGas × 1.5; fixed fallback when estimation fails. */
    private BigInteger estimateGas(String from, String to, BigInteger value, String data) {
        Map<String, Object> tx = new LinkedHashMap<>();
        tx.put("from", from);
        tx.put("to", to);
        tx.put("value", Amounts.toHexQuantity(value));
        if (!data.isEmpty()) {
            tx.put("data", data);
        }
        try {
            BigInteger estimate = Amounts.hexToBigInteger(
                    callOnce(rotator.next(), "eth_estimateGas", List.of(tx), false).asText());
            return estimate.multiply(BigInteger.valueOf(3)).divide(BigInteger.TWO);
        } catch (RpcException e) {
            log.warn("Gas estimation failed on {}, using fallback {}: {}", chainId, FALLBACK_GAS_LIMIT, e.getMessage());
            return FALLBACK_GAS_LIMIT;
        }
    }

    private static boolean isAlreadyKnown(String message) {
        String m = message == null ? "" : message.toLowerCase(Locale.ROOT);
        return m.contains("already known") || m.contains("known transaction") || m.contains("already imported");
    }

    private long latestBlock() {
        if (latestBlockCache != null) {
            Long cached = latestBlockCache.get(chainId.name(), Long.class);
            if (cached != null) {
                return cached;
            }
        }
        long latest = Amounts.hexToBigInteger(callWithRetry("eth_blockNumber", List.of(), false).asText()).longValue();
        if (latestBlockCache != null) {
            latestBlockCache.put(chainId.name(), latest);
        }
        return latest;
    }

    private JsonNode callWithRetry(String method, Object params, boolean allowNullResult) {
        RpcException lastException = null;
        for (int attempt = 0; attempt < rotator.maxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepQuietly(rotator.backoffMs(attempt - 1));
            }
            String endpoint = rotator.next();
            try {
                return callOnce(endpoint, method, params, allowNullResult);
            } catch (RpcException e) {
                lastException = e;
                log.debug("{} on {} failed (attempt {}/{}): {}",
                        method, chainId, attempt + 1, rotator.maxAttempts(), e.getMessage());
            }
        }
        throw new RpcException(method + " failed on " + chainId + " after " + rotator.maxAttempts()
                + " attempts: " + messageOf(lastException), lastException);
    }

    private JsonNode callOnce(String endpoint, String method, Object params, boolean allowNullResult) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + chainId);
        }
        if (waitedMs >= Math.max(1L, limiterLogThresholdMs)) {
            log.info("Local RPC limiter delayed {} ms before {} on {}", waitedMs, method, chainId);
        }
        String json;
        try {
            json = rpcClient.call(endpoint, method, params).block();
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RpcException(method + " transport failure on " + chainId + ": " + e.getMessage(), e);
        }
        return extractResult(json, allowNullResult);
    }

    private JsonNode extractResult(String json, boolean allowNullResult) {
        if (json == null || json.isBlank()) {
            throw new RpcException("Empty RPC response from " + chainId);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Malformed RPC response from " + chainId, e);
        }
        if (root.hasNonNull("error")) {
            JsonNode error = root.get("error");
            throw RpcException.nodeError(error.hasNonNull("message") ? error.get("message").asText() : error.toString());
        }
        JsonNode result = root.get("result");
        if (result == null || result.isNull()) {
            if (allowNullResult) {
                return null;
            }
            throw new RpcException("RPC response has no result from " + chainId);
        }
        return result;
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during RPC retry", e);
        }
    }

    private static String messageOf(Exception e) {
        return e == null || e.getMessage() == null ? "unknown" : e.getMessage();
    }
}
