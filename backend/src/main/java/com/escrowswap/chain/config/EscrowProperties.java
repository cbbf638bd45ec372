package com.escrowswap.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Escrow wallet. The private key is optional; without it the service accepts deposits and swaps but cannot pay
 * out (no synchronous payout, no settlement).
 */
@ConfigurationProperties(prefix = "escrowswap.escrow")
@NoArgsConstructor
@Getter
@Setter
public class EscrowProperties {

    private String address = "0x9c77c6fafc1eb0821F1De12972Ef0199C97C6e45";

    /** Hex private key, normally from ESCROW_PRIVATE_KEY. */
    private String privateKey;
}
