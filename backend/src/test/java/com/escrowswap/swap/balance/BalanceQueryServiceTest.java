package com.escrowswap.swap.balance;

import com.escrowswap.chain.ChainClient;
import com.escrowswap.chain.ChainClientRegistry;
import com.escrowswap.chain.RpcException;
import com.escrowswap.domain.ChainId;
import com.escrowswap.domain.TokenRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BalanceQueryServiceTest {

    private static final String WALLET = "0x1A87f12aC07E9746e9B053B8D7EF1d45270D693f";
    private static final String MXNB = "0xF197FFC28c23E0309B5559e7a166f2c6164C80aA";

    @Test
    @DisplayName("native and token balances are returned for every configured chain")
    void balances_allConfiguredChains() {
        ChainClient arbitrum = mock(ChainClient.class);
        when(arbitrum.chainId()).thenReturn(ChainId.ARBITRUM);
        when(arbitrum.readBalance(org.mockito.ArgumentMatchers.any(), anyString())).thenCallRealMethod();
        when(arbitrum.getBalance(WALLET)).thenReturn(new BigInteger("1500000000000000000"));
        when(arbitrum.readTokenBalance(MXNB, WALLET)).thenReturn(BigInteger.valueOf(12_340_000L));
        BalanceQueryService service = service(arbitrum);

        List<TokenBalance> balances = service.balances(WALLET, null);

        assertThat(balances).extracting(TokenBalance::symbol).containsExactlyInAnyOrder("MXNB", "ETH");
        assertThat(balances).filteredOn(b -> b.symbol().equals("MXNB")).singleElement()
                .extracting(TokenBalance::amount).isEqualTo("12.34");
        assertThat(balances).filteredOn(b -> b.symbol().equals("ETH")).singleElement()
                .extracting(TokenBalance::amount).isEqualTo("1.5");
    }

    @Test
    @DisplayName("a failed read marks only that entry unavailable")
    void balances_partialFailure() {
        ChainClient arbitrum = mock(ChainClient.class);
        when(arbitrum.chainId()).thenReturn(ChainId.ARBITRUM);
        when(arbitrum.readBalance(org.mockito.ArgumentMatchers.any(), anyString())).thenCallRealMethod();
        when(arbitrum.getBalance(WALLET)).thenThrow(new RpcException("timeout"));
        when(arbitrum.readTokenBalance(MXNB, WALLET)).thenReturn(BigInteger.ONE);
        BalanceQueryService service = service(arbitrum);

        List<TokenBalance> balances = service.balances(WALLET, List.of(ChainId.ARBITRUM));

        assertThat(balances).filteredOn(b -> !b.available()).extracting(TokenBalance::symbol).containsExactly("ETH");
        assertThat(balances).filteredOn(TokenBalance::available).extracting(TokenBalance::amount).containsExactly("0.000001");
    }

    @Test
    void balances_chainWithoutClient_isUnavailable() {
        BalanceQueryService service = service();

        List<TokenBalance> balances = service.balances(WALLET, List.of(ChainId.CELO));

        assertThat(balances).hasSize(2).noneMatch(TokenBalance::available);
    }

    private static BalanceQueryService service(ChainClient... clients) {
        ChainClientRegistry registry = new ChainClientRegistry(List.of(clients));
        return new BalanceQueryService(new BalanceVerifier(registry), new TokenRegistry(), registry, Runnable::run);
    }
}
