package com.escrowswap.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Fixed-point helpers: decimal strings ↔ integer base units scaled by token decimals.
 */
public final class Amounts {

    private Amounts() {
    }

    /**
     * Parses a plain decimal string (no exponent, no sign). Empty when malformed.
     */
    public static Optional<BigDecimal> parseDecimal(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (!trimmed.matches("\\d+(\\.\\d+)?|\\.\\d+")) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(trimmed));
    }

    /** Number of fraction digits after stripping trailing zeros. */
    public static int significantScale(BigDecimal value) {
        return Math.max(0, value.stripTrailingZeros().scale());
    }

    /**
     * Scales to base units, truncating any digits beyond {@code decimals}.
     */
    public static BigInteger toBaseUnits(BigDecimal amount, int decimals) {
        return amount.movePointRight(decimals).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    }

    public static BigDecimal fromBaseUnits(BigInteger baseUnits, int decimals) {
        return new BigDecimal(baseUnits, decimals);
    }

    /**
     * Display form: trailing zeros stripped, at least one fraction digit ("1.0", "4.975").
     */
    public static String toDisplay(BigDecimal amount) {
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.scale() < 1) {
            stripped = stripped.setScale(1, RoundingMode.UNNECESSARY);
        }
        return stripped.toPlainString();
    }

    /** Shortest plain form: no exponent, no trailing zeros ("0.000001", "1000"). */
    public static String toPlain(BigDecimal amount) {
        return amount.stripTrailingZeros().toPlainString();
    }

    public static String toDisplay(BigInteger baseUnits, int decimals) {
        return toDisplay(fromBaseUnits(baseUnits, decimals));
    }

    /** Parses a 0x-prefixed hex quantity; "0x" alone is zero. */
    public static BigInteger hexToBigInteger(String hex) {
        if (hex == null || hex.isBlank()) {
            return BigInteger.ZERO;
        }
        String h = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (h.isEmpty()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(h, 16);
    }

    public static String toHexQuantity(BigInteger value) {
        return "0x" + value.toString(16);
    }
}
