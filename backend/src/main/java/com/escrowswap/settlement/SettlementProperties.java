package com.escrowswap.settlement;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Payout leg settings.
 */
@ConfigurationProperties(prefix = "escrowswap.settlement")
@NoArgsConstructor
@Getter
@Setter
public class SettlementProperties {

    private boolean enabled = true;

    /** Delay between settlement passes. */
    private long intervalMs = 30_000L;

    /** Source-leg confirmations required before paying out. */
    private int requiredConfirmations = 1;

    /** Payouts that could not be signed (nonce, gas price or estimate unavailable) before the swap is marked FAILED. */
    private int maxAttempts = 5;

    /** Pending swaps older than this are marked FAILED. */
    private Duration expireAfter = Duration.ofHours(24);

    /** Native balance the escrow must hold on the target chain to pay gas. */
    private BigDecimal minGasBalance = new BigDecimal("0.0001");
}
