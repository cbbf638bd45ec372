package com.escrowswap.api.dto;

import com.escrowswap.domain.ChainId;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * POST /api/v1/escrow/deposits request body.
 */
public record EscrowDepositRequest(
        @NotNull(message = "INVALID_REQUEST") ChainId chain,
        @NotBlank(message = "INVALID_REQUEST") String token,
        @NotBlank(message = "INVALID_AMOUNT") String amount
) {
}
