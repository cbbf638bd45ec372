package com.escrowswap.swap.rate;

import com.escrowswap.common.Amounts;
import com.escrowswap.domain.TokenRef;
import com.escrowswap.swap.error.SwapError;
import com.escrowswap.swap.error.SwapException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static conversion rates between (chain, token) pairs and one global fee.
 * <p>
 * {@code output = amount * rate * (1 - fee/100)}, truncated to the target token's decimals so the quoted amount
 * never exceeds what the exact product would pay.
 */
public class RateFeeTable {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal feePercent;
    private final Map<String, ConversionRate> ratesByPair;

    public RateFeeTable(BigDecimal feePercent, Collection<ConversionRate> rates) {
        if (feePercent == null || feePercent.signum() < 0 || feePercent.compareTo(HUNDRED) >= 0) {
            throw new IllegalArgumentException("Fee percent must satisfy 0 <= fee < 100, got " + feePercent);
        }
        this.feePercent = feePercent;
        Map<String, ConversionRate> map = new LinkedHashMap<>();
        for (ConversionRate rate : rates) {
            ConversionRate previous = map.putIfAbsent(pairKey(rate.from(), rate.to()), rate);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate rate for " + rate.from().key() + " -> " + rate.to().key());
            }
        }
        this.ratesByPair = map;
    }

    /**
     * Converts {@code amount} of {@code from} into {@code to}, fee applied.
     *
     * @return decimal string with exactly {@code to.decimals()} fraction digits
     * @throws SwapException UNSUPPORTED_PAIR when no rate exists for the ordered pair
     */
    public String convert(String amount, TokenRef from, TokenRef to) {
        BigDecimal parsed = Amounts.parseDecimal(amount)
                .filter(a -> a.signum() > 0)
                .orElseThrow(() -> new IllegalArgumentException("Amount must be a positive decimal: " + amount));
        return convert(parsed, from, to).toPlainString();
    }

    public BigDecimal convert(BigDecimal amount, TokenRef from, TokenRef to) {
        ConversionRate rate = rate(from, to)
                .orElseThrow(() -> new SwapException(SwapError.unsupportedPair(from.key(), to.key())));
        BigDecimal gross = amount.multiply(rate.rate());
        BigDecimal net = gross.multiply(HUNDRED.subtract(feePercent)).divide(HUNDRED);
        return net.setScale(to.decimals(), RoundingMode.DOWN);
    }

    public Optional<ConversionRate> rate(TokenRef from, TokenRef to) {
        return Optional.ofNullable(ratesByPair.get(pairKey(from, to)));
    }

    public List<ConversionRate> supportedPairs() {
        return List.copyOf(ratesByPair.values());
    }

    public BigDecimal feePercent() {
        return feePercent;
    }

    private static String pairKey(TokenRef from, TokenRef to) {
        return from.key() + "->" + to.key();
    }
}
