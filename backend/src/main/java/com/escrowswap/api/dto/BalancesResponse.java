package com.escrowswap.api.dto;

import com.escrowswap.swap.balance.TokenBalance;

import java.util.List;

public record BalancesResponse(String address, List<TokenBalance> balances) {
}
