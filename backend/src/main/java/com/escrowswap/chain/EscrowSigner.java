package com.escrowswap.chain;

import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;

/**
 * Holds the escrow wallet key. The key is checked against the configured escrow address on construction and is
 * never exposed: there is no getter and toString leaves it out.
 */
public final class EscrowSigner {

    private final String escrowAddress;
    private final Credentials credentials;

    private EscrowSigner(String escrowAddress, Credentials credentials) {
        this.escrowAddress = escrowAddress;
        this.credentials = credentials;
    }

    /**
     * @throws IllegalStateException when the key is malformed or derives a different address
     */
    public static EscrowSigner create(String escrowAddress, String privateKey) {
        if (privateKey == null || privateKey.isBlank()) {
            return withoutKey(escrowAddress);
        }
        Credentials credentials;
        try {
            credentials = Credentials.create(privateKey.trim());
        } catch (RuntimeException e) {
            // cause dropped: parser messages can echo the input
            throw new IllegalStateException("Escrow private key is malformed");
        }
        if (escrowAddress != null && !credentials.getAddress().equalsIgnoreCase(escrowAddress.trim())) {
            throw new IllegalStateException("Escrow private key does not match escrow address " + escrowAddress);
        }
        return new EscrowSigner(escrowAddress != null ? escrowAddress.trim() : credentials.getAddress(), credentials);
    }

    /** Read-only escrow: deposits and balance checks work, payouts do not. */
    public static EscrowSigner withoutKey(String escrowAddress) {
        return new EscrowSigner(escrowAddress, null);
    }

    public boolean isAvailable() {
        return credentials != null;
    }

    public String address() {
        return escrowAddress;
    }

    /**
     * EIP-155 signature of {@code transaction} for {@code chainId}.
     */
    public byte[] sign(RawTransaction transaction, long chainId) {
        if (credentials == null) {
            throw new IllegalStateException("Escrow signer has no private key configured");
        }
        return TransactionEncoder.signMessage(transaction, chainId, credentials);
    }

    @Override
    public String toString() {
        return "EscrowSigner[address=" + escrowAddress + ", available=" + isAvailable() + "]";
    }
}
