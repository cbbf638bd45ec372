package com.escrowswap.settlement;

import com.escrowswap.chain.EscrowSigner;
import com.escrowswap.domain.TokenRef;
import com.escrowswap.swap.balance.BalanceQueryService;
import com.escrowswap.swap.balance.TokenBalance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Reports escrow liquidity on every configured chain at startup: unreadable, zero and low balances are WARNed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EscrowLiquidityMonitor {

    private final BalanceQueryService balanceQueryService;
    private final EscrowSigner escrowSigner;
    private final MonitorProperties monitorProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        if (!monitorProperties.isStartupCheck()) {
            return;
        }
        try {
            checkLiquidity();
        } catch (RuntimeException e) {
            log.warn("Escrow liquidity check failed: {}", e.getMessage());
        }
    }

    /**
     * @return balances that are unreadable, zero or below the configured thresholds
     */
    public List<TokenBalance> checkLiquidity() {
        List<TokenBalance> balances = balanceQueryService.balances(escrowSigner.address(), null);
        List<TokenBalance> flagged = new ArrayList<>();
        for (TokenBalance b : balances) {
            if (!b.available()) {
                log.warn("Escrow balance of {} on {} could not be read", b.symbol(), b.chain());
                flagged.add(b);
                continue;
            }
            BigDecimal amount = new BigDecimal(b.amount());
            boolean nativeAsset = TokenRef.NATIVE_ADDRESS.equalsIgnoreCase(b.tokenAddress());
            BigDecimal threshold = nativeAsset ? monitorProperties.getLowNativeBalance() : monitorProperties.getLowTokenBalance();
            if (amount.signum() == 0) {
                log.warn("Escrow {} has zero {} on {}", escrowSigner.address(), b.symbol(), b.chain());
                flagged.add(b);
            } else if (amount.compareTo(threshold) < 0) {
                log.warn("Escrow {} is low on {} on {}: {}", escrowSigner.address(), b.symbol(), b.chain(), b.amount());
                flagged.add(b);
            }
        }
        log.info("Escrow liquidity checked: {} balances, {} flagged", balances.size(), flagged.size());
        return flagged;
    }
}
