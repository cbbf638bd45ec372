package com.escrowswap.domain;

import java.util.Locale;

/**
 * Payload classification by 4-byte selector.
 */
public enum TransactionDataType {
    NATIVE_TRANSFER,
    TOKEN_TRANSFER,
    TOKEN_APPROVAL,
    CONTRACT_CALL;

    private static final String TRANSFER_SELECTOR = "0xa9059cbb";
    private static final String APPROVE_SELECTOR = "0x095ea7b3";

    public static TransactionDataType classify(String data) {
        if (data == null || data.isBlank() || "0x".equalsIgnoreCase(data)) {
            return NATIVE_TRANSFER;
        }
        String lower = data.toLowerCase(Locale.ROOT);
        if (lower.startsWith(TRANSFER_SELECTOR)) {
            return TOKEN_TRANSFER;
        }
        if (lower.startsWith(APPROVE_SELECTOR)) {
            return TOKEN_APPROVAL;
        }
        return CONTRACT_CALL;
    }
}
