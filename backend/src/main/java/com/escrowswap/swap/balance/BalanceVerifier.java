package com.escrowswap.swap.balance;

import com.escrowswap.chain.ChainClientRegistry;
import com.escrowswap.chain.RpcException;
import com.escrowswap.common.Amounts;
import com.escrowswap.domain.TokenRef;
import com.escrowswap.swap.error.SwapError;
import com.escrowswap.swap.error.SwapException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Checks that an address holds at least a given amount of a token. Comparison is on integer base units.
 * Read failures become CHAIN_UNAVAILABLE; the RPC error text is logged, not returned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BalanceVerifier {

    private final ChainClientRegistry chainClientRegistry;

    /**
     * Sender-side check.
     *
     * @throws SwapException INSUFFICIENT_BALANCE or CHAIN_UNAVAILABLE
     */
    public void requireBalance(TokenRef token, String address, BigDecimal minimum) {
        BigInteger need = Amounts.toBaseUnits(minimum, token.decimals());
        BigInteger have = readBalance(token, address);
        if (have.compareTo(need) < 0) {
            throw new SwapException(SwapError.insufficientBalance(
                    Amounts.toDisplay(have, token.decimals()), Amounts.toDisplay(minimum), token.symbol()));
        }
    }

    /**
     * Escrow-side check; a shortfall is an operator liquidity problem and is logged at WARN.
     *
     * @throws SwapException INSUFFICIENT_ESCROW_BALANCE or CHAIN_UNAVAILABLE
     */
    public void requireEscrowBalance(TokenRef token, String escrowAddress, BigDecimal minimum) {
        BigInteger need = Amounts.toBaseUnits(minimum, token.decimals());
        BigInteger have = readBalance(token, escrowAddress);
        if (have.compareTo(need) < 0) {
            String haveDisplay = Amounts.toDisplay(have, token.decimals());
            log.warn("Escrow liquidity short on {}: has {} {}, needs {}",
                    token.chainId(), haveDisplay, token.symbol(), Amounts.toDisplay(minimum));
            throw new SwapException(SwapError.insufficientEscrowBalance(
                    token.chainId(), haveDisplay, Amounts.toDisplay(minimum), token.symbol()));
        }
    }

    /**
     * @throws SwapException CHAIN_UNAVAILABLE when the chain has no client or the read fails
     */
    public BigInteger readBalance(TokenRef token, String address) {
        try {
            return chainClientRegistry.require(token.chainId()).readBalance(token, address);
        } catch (RpcException e) {
            log.warn("Balance read failed for {} {} on {}: {}", address, token.symbol(), token.chainId(), e.getMessage());
            throw new SwapException(SwapError.chainUnavailable(token.chainId()), e);
        }
    }
}
