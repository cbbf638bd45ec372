package com.escrowswap.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * RPC retry policy for chain reads (exponential backoff ± jitter).
 */
@ConfigurationProperties(prefix = "escrowswap.chain.retry")
@NoArgsConstructor
@Getter
@Setter
public class ChainRetryProperties {

    /** Base delay in ms for the first retry; doubles each attempt. */
    private long baseDelayMs = 100L;

    /** Jitter factor 0..1 (0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Total attempts including the first call. */
    private int maxAttempts = 3;
}
