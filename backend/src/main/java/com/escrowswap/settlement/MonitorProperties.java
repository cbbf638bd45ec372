package com.escrowswap.settlement;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Escrow liquidity check at startup.
 */
@ConfigurationProperties(prefix = "escrowswap.monitor")
@NoArgsConstructor
@Getter
@Setter
public class MonitorProperties {

    private boolean startupCheck = true;

    /** Token balances below this are reported as low. */
    private BigDecimal lowTokenBalance = new BigDecimal("10");

    /** Native (gas) balances below this are reported as low. */
    private BigDecimal lowNativeBalance = new BigDecimal("0.001");
}
