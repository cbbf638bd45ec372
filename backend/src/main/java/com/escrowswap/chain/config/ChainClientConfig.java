package com.escrowswap.chain.config;

import com.escrowswap.chain.ChainClientRegistry;
import com.escrowswap.chain.EscrowSigner;
import com.escrowswap.chain.RpcEndpointRotator;
import com.escrowswap.chain.evm.EvmChainClient;
import com.escrowswap.chain.evm.EvmRpcClient;
import com.escrowswap.chain.evm.WebClientEvmRpcClient;
import com.escrowswap.common.RetryPolicy;
import com.escrowswap.config.CaffeineConfig;
import com.escrowswap.domain.ChainId;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds one EVM chain client per chain with configured RPC URLs, the shared RPC rate limiter and the escrow signer.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({ ChainNetworkProperties.class, ChainRetryProperties.class, ChainEvmRpcProperties.class, EscrowProperties.class })
public class ChainClientConfig {

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder, ChainEvmRpcProperties rpcProperties) {
        return new WebClientEvmRpcClient(webClientBuilder, Duration.ofMillis(Math.max(1L, rpcProperties.getRequestTimeoutMs())));
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(ChainEvmRpcProperties rpcProperties) {
        int rps = Math.max(1, rpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    public ChainClientRegistry chainClientRegistry(ChainNetworkProperties networkProperties,
                                                   ChainRetryProperties retryProperties,
                                                   ChainEvmRpcProperties rpcProperties,
                                                   EvmRpcClient evmRpcClient,
                                                   ObjectMapper objectMapper,
                                                   @Qualifier("evmRpcRateLimiter") RateLimiter evmRpcRateLimiter,
                                                   CacheManager cacheManager) {
        RetryPolicy retryPolicy = new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
        List<EvmChainClient> clients = new ArrayList<>();
        for (Map.Entry<String, ChainNetworkProperties.NetworkEntry> entry : networkProperties.getNetwork().entrySet()) {
            Optional<ChainId> chainId = ChainId.fromName(entry.getKey());
            if (chainId.isEmpty()) {
                throw new IllegalStateException("Unknown chain in escrowswap.chain.network: " + entry.getKey());
            }
            if (entry.getValue() == null
                    || entry.getValue().getUrls().stream().allMatch(url -> url == null || url.isBlank())) {
                log.warn("No RPC URLs for {}; chain disabled", chainId.get());
                continue;
            }
            clients.add(new EvmChainClient(
                    chainId.get(),
                    new RpcEndpointRotator(chainId.get(), entry.getValue().getUrls(), retryPolicy),
                    evmRpcClient,
                    objectMapper,
                    evmRpcRateLimiter,
                    rpcProperties.getLocalLimiterLogThresholdMs(),
                    cacheManager.getCache(CaffeineConfig.LATEST_BLOCK_CACHE)));
        }
        ChainClientRegistry registry = new ChainClientRegistry(clients);
        log.info("Chain clients configured for {}", registry.chains());
        return registry;
    }

    @Bean
    public EscrowSigner escrowSigner(EscrowProperties escrowProperties) {
        EscrowSigner signer = EscrowSigner.create(escrowProperties.getAddress(), escrowProperties.getPrivateKey());
        if (signer.isAvailable()) {
            log.info("Escrow signer ready for {}", signer.address());
        } else {
            log.warn("No escrow private key configured for {}; payouts are disabled", signer.address());
        }
        return signer;
    }
}
