package com.escrowswap.swap.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Swap pricing and limits. Rates are keyed "CHAIN:SYMBOL" (e.g. ARBITRUM:MXNB), one entry per directed pair.
 */
@ConfigurationProperties(prefix = "escrowswap.swap")
@NoArgsConstructor
@Getter
@Setter
public class SwapProperties {

    /** Global fee in percent, 0 <= fee < 100. */
    private BigDecimal feePercent = new BigDecimal("0.5");

    private BigDecimal minAmount = new BigDecimal("0.000001");

    private BigDecimal maxAmount = new BigDecimal("1000");

    /** Pay same-chain swaps out immediately with the escrow key instead of leaving them to settlement. */
    private boolean syncPayoutEnabled = true;

    private List<RateEntry> rates = new ArrayList<>();

    public void setRates(List<RateEntry> rates) {
        this.rates = rates != null ? rates : new ArrayList<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class RateEntry {

        private String from;
        private String to;
        private BigDecimal rate;
    }
}
