package com.escrowswap.api.dto;

import com.escrowswap.api.validation.EvmAddress;
import com.escrowswap.domain.ChainId;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * POST /api/v1/swaps request body. Amount is a decimal string in source-token units; recipient defaults to the
 * sender.
 */
public record InitiateSwapRequest(
        @NotNull(message = "INVALID_REQUEST") ChainId sourceChain,
        @NotBlank(message = "INVALID_REQUEST") String sourceToken,
        @NotNull(message = "INVALID_REQUEST") ChainId targetChain,
        @NotBlank(message = "INVALID_REQUEST") String targetToken,
        @NotBlank(message = "INVALID_AMOUNT") String amount,
        @EvmAddress String recipientAddress
) {
}
