package com.escrowswap.api.dto;

public record EscrowDepositResponse(String transactionId, String summary) {
}
