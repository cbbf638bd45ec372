package com.escrowswap.swap.error;

import com.escrowswap.domain.ChainId;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed failure with a short user-facing message and the values it was built from.
 */
public record SwapError(SwapErrorKind kind, String message, Map<String, String> details) {

    public SwapError {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static SwapError invalidAmount(String amount, String min, String max, String token) {
        return new SwapError(SwapErrorKind.INVALID_AMOUNT,
                "Amount must be between " + min + " and " + max + " " + token,
                details("amount", amount, "min", min, "max", max, "token", token));
    }

    public static SwapError invalidAddress(String address) {
        return new SwapError(SwapErrorKind.INVALID_ADDRESS, "Invalid address: " + address,
                details("address", address));
    }

    public static SwapError insufficientBalance(String have, String need, String token) {
        return new SwapError(SwapErrorKind.INSUFFICIENT_BALANCE,
                "Insufficient balance. You have " + have + " " + token + ", but " + need + " " + token + " is required.",
                details("have", have, "need", need, "token", token));
    }

    public static SwapError insufficientEscrowBalance(ChainId chain, String have, String need, String token) {
        return new SwapError(SwapErrorKind.INSUFFICIENT_ESCROW_BALANCE,
                "Insufficient escrow balance on " + chain.displayName() + ". Escrow has " + have + " " + token
                        + ", but " + need + " " + token + " is required.",
                details("chain", chain.name(), "have", have, "need", need, "token", token));
    }

    public static SwapError unsupportedPair(String fromKey, String toKey) {
        return new SwapError(SwapErrorKind.UNSUPPORTED_PAIR,
                "Swapping " + fromKey + " to " + toKey + " is not supported",
                details("from", fromKey, "to", toKey));
    }

    public static SwapError unsupportedToken(ChainId chain, String symbol) {
        return new SwapError(SwapErrorKind.UNSUPPORTED_PAIR,
                "Token " + symbol + " is not supported on " + chain.displayName(),
                details("chain", chain.name(), "token", symbol));
    }

    public static SwapError transactionFailed(String reason) {
        return new SwapError(SwapErrorKind.TRANSACTION_FAILED, "Transaction failed: " + reason,
                details("reason", reason));
    }

    public static SwapError wrongNetwork(ChainId required, ChainId current) {
        String currentName = current != null ? current.displayName() : "an unknown network";
        return new SwapError(SwapErrorKind.WRONG_NETWORK,
                "Please switch to " + required.displayName() + ". You are currently on " + currentName + ".",
                details("required", required.name(), "current", current != null ? current.name() : "UNKNOWN"));
    }

    public static SwapError notFound(String what) {
        return new SwapError(SwapErrorKind.NOT_FOUND, what, Map.of());
    }

    public static SwapError chainUnavailable(ChainId chain) {
        return new SwapError(SwapErrorKind.CHAIN_UNAVAILABLE,
                "Unable to read balances on " + chain.displayName() + " right now. Please try again later.",
                details("chain", chain.name()));
    }

    private static Map<String, String> details(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(keyValues[i], keyValues[i + 1]);
            }
        }
        return map;
    }
}
