package com.escrowswap.chain;

import java.math.BigInteger;

/**
 * A signed transfer ready for broadcast. The hash is known before sending, and re-sending the same raw
 * transaction can never pay twice because the nonce is fixed.
 *
 * @param hash           keccak-256 of {@code rawTransaction}
 * @param rawTransaction 0x-prefixed signed transaction bytes
 */
public record SignedTransfer(String hash, String rawTransaction, BigInteger nonce) {
}
