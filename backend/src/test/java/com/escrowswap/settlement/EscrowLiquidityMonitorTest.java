package com.escrowswap.settlement;

import com.escrowswap.chain.EscrowSigner;
import com.escrowswap.domain.ChainId;
import com.escrowswap.domain.TokenRef;
import com.escrowswap.swap.balance.BalanceQueryService;
import com.escrowswap.swap.balance.TokenBalance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EscrowLiquidityMonitorTest {

    private static final String ESCROW = "0x9c77c6fafc1eb0821F1De12972Ef0199C97C6e45";
    private static final String XOC = "0xa411c9Aa00E020e4f88Bc19996d29c5B7ADB4ACf";

    @Mock
    private BalanceQueryService balanceQueryService;

    @Test
    @DisplayName("unreadable, zero and low balances are flagged; healthy ones are not")
    void checkLiquidity_flagsProblems() {
        when(balanceQueryService.balances(ESCROW, null)).thenReturn(List.of(
                new TokenBalance(ChainId.BASE, "XOC", XOC, "500.0", true),
                new TokenBalance(ChainId.BASE, "ETH", TokenRef.NATIVE_ADDRESS, "0.0005", true),
                new TokenBalance(ChainId.ARBITRUM, "MXNB", "0xF197FFC28c23E0309B5559e7a166f2c6164C80aA", "0.0", true),
                TokenBalance.unavailable(ChainId.CELO, "cUSD", "0x765DE816845861e75A25fCA122bb6898B8B1282a")));
        EscrowLiquidityMonitor monitor = new EscrowLiquidityMonitor(balanceQueryService,
                EscrowSigner.withoutKey(ESCROW), new MonitorProperties());

        List<TokenBalance> flagged = monitor.checkLiquidity();

        assertThat(flagged).extracting(TokenBalance::symbol).containsExactly("ETH", "MXNB", "cUSD");
    }

    @Test
    void startupCheckDisabled_readsNothing() {
        MonitorProperties properties = new MonitorProperties();
        properties.setStartupCheck(false);
        EscrowLiquidityMonitor monitor = new EscrowLiquidityMonitor(balanceQueryService,
                EscrowSigner.withoutKey(ESCROW), properties);

        monitor.onApplicationReady(null);

        verify(balanceQueryService, never()).balances(any(), any());
    }
}
