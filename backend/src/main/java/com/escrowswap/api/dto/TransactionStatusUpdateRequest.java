package com.escrowswap.api.dto;

import com.escrowswap.domain.PendingTransactionStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Status report from the external signer. {@code hash} is the broadcast transaction hash, when known.
 */
public record TransactionStatusUpdateRequest(
        @NotNull(message = "INVALID_STATUS") PendingTransactionStatus status,
        @Pattern(regexp = "^0x[0-9a-fA-F]{64}$", message = "INVALID_HASH") String hash
) {
}
