package com.escrowswap.api.controller;

/**
 * Request headers that carry the caller's wallet session.
 */
final class WalletHeaders {

    static final String ADDRESS = "X-Wallet-Address";
    static final String CHAIN = "X-Wallet-Chain";

    private WalletHeaders() {
    }
}
