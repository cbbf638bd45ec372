package com.escrowswap.swap.config;

import com.escrowswap.domain.ChainId;
import com.escrowswap.domain.TokenRef;
import com.escrowswap.domain.TokenRegistry;
import com.escrowswap.swap.rate.ConversionRate;
import com.escrowswap.swap.rate.RateFeeTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the rate table from escrowswap.swap.rates; unknown tokens, duplicate pairs and an out-of-range fee fail
 * startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({ SwapProperties.class, TrackerProperties.class })
public class SwapConfig {

    @Bean
    public RateFeeTable rateFeeTable(SwapProperties swapProperties, TokenRegistry tokenRegistry) {
        if (swapProperties.getMinAmount().signum() <= 0
                || swapProperties.getMaxAmount().compareTo(swapProperties.getMinAmount()) < 0) {
            throw new IllegalStateException("Swap amount bounds must satisfy 0 < min <= max");
        }
        List<ConversionRate> rates = swapProperties.getRates().stream()
                .map(e -> new ConversionRate(token(e.getFrom(), tokenRegistry), token(e.getTo(), tokenRegistry), e.getRate()))
                .toList();
        RateFeeTable table = new RateFeeTable(swapProperties.getFeePercent(), rates);
        log.info("Rate table loaded: {} pairs, fee {}%", rates.size(), table.feePercent());
        return table;
    }

    private static TokenRef token(String key, TokenRegistry tokenRegistry) {
        if (key == null || !key.contains(":")) {
            throw new IllegalStateException("Rate token must be CHAIN:SYMBOL, got " + key);
        }
        String[] parts = key.split(":", 2);
        ChainId chain = ChainId.fromName(parts[0])
                .orElseThrow(() -> new IllegalStateException("Unknown chain in rate key " + key));
        return tokenRegistry.find(chain, parts[1])
                .orElseThrow(() -> new IllegalStateException("Unknown token in rate key " + key));
    }
}
