package com.escrowswap.swap.rate;

import com.escrowswap.domain.TokenRef;

import java.math.BigDecimal;

/**
 * Multiplier for one directed pair. Rates are not required to be reciprocal.
 */
public record ConversionRate(TokenRef from, TokenRef to, BigDecimal rate) {

    public ConversionRate {
        if (from == null || to == null || rate == null) {
            throw new IllegalArgumentException("from, to and rate are required");
        }
        if (rate.signum() <= 0) {
            throw new IllegalArgumentException("Rate must be positive for " + from.key() + " -> " + to.key());
        }
        if (from.equals(to)) {
            throw new IllegalArgumentException("Rate from a token to itself: " + from.key());
        }
    }
}
