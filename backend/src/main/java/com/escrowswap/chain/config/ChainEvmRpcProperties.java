package com.escrowswap.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * EVM RPC throttling and timeouts.
 */
@ConfigurationProperties(prefix = "escrowswap.chain.evm-rpc")
@NoArgsConstructor
@Getter
@Setter
public class ChainEvmRpcProperties {

    /** Global RPC budget (requests per second) for this service instance, all chains together. */
    private int maxRequestsPerSecond = 50;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 2_000;

    /** Per-request HTTP timeout. */
    private long requestTimeoutMs = 30_000;
}
