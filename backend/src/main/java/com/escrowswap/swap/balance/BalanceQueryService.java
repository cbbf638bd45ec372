package com.escrowswap.swap.balance;

import com.escrowswap.chain.ChainClientRegistry;
import com.escrowswap.common.Amounts;
import com.escrowswap.config.AsyncConfig;
import com.escrowswap.domain.ChainId;
import com.escrowswap.domain.TokenRef;
import com.escrowswap.domain.TokenRegistry;
import com.escrowswap.swap.error.SwapException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Multichain balance lookup: every (chain, token) read runs in parallel on the balance executor and the
 * results are joined. A failed read yields an unavailable entry instead of failing the whole query.
 */
@Slf4j
@Service
public class BalanceQueryService {

    private final BalanceVerifier balanceVerifier;
    private final TokenRegistry tokenRegistry;
    private final ChainClientRegistry chainClientRegistry;
    private final Executor balanceExecutor;

    public BalanceQueryService(BalanceVerifier balanceVerifier,
                               TokenRegistry tokenRegistry,
                               ChainClientRegistry chainClientRegistry,
                               @Qualifier(AsyncConfig.BALANCE_EXECUTOR) Executor balanceExecutor) {
        this.balanceVerifier = balanceVerifier;
        this.tokenRegistry = tokenRegistry;
        this.chainClientRegistry = chainClientRegistry;
        this.balanceExecutor = balanceExecutor;
    }

    /**
     * @param chains chains to query; null or empty = every chain with a configured client
     */
    public List<TokenBalance> balances(String address, Collection<ChainId> chains) {
        Collection<ChainId> targets = chains == null || chains.isEmpty() ? chainClientRegistry.chains() : chains;
        List<CompletableFuture<TokenBalance>> futures = targets.stream()
                .flatMap(chain -> tokenRegistry.tokensOn(chain).stream())
                .map(token -> CompletableFuture.supplyAsync(() -> read(token, address), balanceExecutor))
                .toList();
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private TokenBalance read(TokenRef token, String address) {
        try {
            BigInteger baseUnits = balanceVerifier.readBalance(token, address);
            return new TokenBalance(token.chainId(), token.symbol(), token.address(),
                    Amounts.toDisplay(baseUnits, token.decimals()), true);
        } catch (SwapException e) {
            log.debug("Balance unavailable for {} {} on {}", address, token.symbol(), token.chainId());
            return TokenBalance.unavailable(token.chainId(), token.symbol(), token.address());
        }
    }
}
