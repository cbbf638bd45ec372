package com.escrowswap.api.controller;

import com.escrowswap.api.dto.ErrorBody;
import com.escrowswap.swap.error.SwapError;
import com.escrowswap.swap.error.SwapErrorKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps typed swap errors to HTTP responses.
 */
final class SwapErrorResponses {

    private SwapErrorResponses() {
    }

    static ResponseEntity<ErrorBody> toResponse(SwapError error) {
        return ResponseEntity.status(statusOf(error.kind()))
                .body(ErrorBody.of(error.kind().name(), error.message(), error.details()));
    }

    static HttpStatus statusOf(SwapErrorKind kind) {
        return switch (kind) {
            case INVALID_AMOUNT, INVALID_ADDRESS, UNSUPPORTED_PAIR -> HttpStatus.BAD_REQUEST;
            case WRONG_NETWORK -> HttpStatus.CONFLICT;
            case INSUFFICIENT_BALANCE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INSUFFICIENT_ESCROW_BALANCE -> HttpStatus.SERVICE_UNAVAILABLE;
            case TRANSACTION_FAILED, CHAIN_UNAVAILABLE -> HttpStatus.BAD_GATEWAY;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }
}
