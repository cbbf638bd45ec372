package com.escrowswap.domain;

/**
 * Who is expected to sign: the user's wallet (frontend) or a service-held key (backend).
 */
public enum WalletSource {
    FRONTEND_WALLET,
    BACKEND_WALLET
}
