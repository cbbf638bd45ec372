package com.escrowswap.swap.config;

import com.escrowswap.domain.ChainId;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pending transaction tracker settings.
 */
@ConfigurationProperties(prefix = "escrowswap.tracker")
@NoArgsConstructor
@Getter
@Setter
public class TrackerProperties {

    /** Chain assumed for a transaction whose destination matches no known token contract. */
    private ChainId defaultChain = ChainId.CELO;
}
