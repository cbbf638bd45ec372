package com.escrowswap.chain;

import java.math.BigInteger;

/**
 * A transaction as the chain reports it.
 *
 * @param to    receiving account or called contract; empty for contract creation
 * @param input 0x-prefixed call data, "0x" for plain transfers
 */
public record ChainTransaction(String hash, String from, String to, BigInteger value, String input) {
}
