package com.escrowswap.api.controller;

import com.escrowswap.api.dto.EscrowDepositRequest;
import com.escrowswap.api.dto.EscrowDepositResponse;
import com.escrowswap.swap.error.SwapOutcome;
import com.escrowswap.swap.orchestrator.EscrowDeposit;
import com.escrowswap.swap.orchestrator.SwapOrchestrator;
import com.escrowswap.swap.orchestrator.WalletSession;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * POST /escrow/deposits: liquidity provision into the escrow wallet, signed by the caller.
 */
@RestController
@RequestMapping("/api/v1/escrow")
@RequiredArgsConstructor
public class EscrowController {

    private final SwapOrchestrator swapOrchestrator;

    @PostMapping("/deposits")
    public Mono<ResponseEntity<?>> deposit(
            @RequestHeader(name = WalletHeaders.ADDRESS, required = false) String walletAddress,
            @RequestBody @Valid EscrowDepositRequest request) {
        WalletSession session = new WalletSession(walletAddress, request.chain());
        return Mono.<ResponseEntity<?>>fromCallable(() -> toResponse(
                        swapOrchestrator.createEscrowDeposit(session, request.chain(), request.token(), request.amount())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static ResponseEntity<?> toResponse(SwapOutcome<EscrowDeposit> outcome) {
        if (!outcome.isSuccess()) {
            return SwapErrorResponses.toResponse(outcome.error());
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new EscrowDepositResponse(outcome.value().transactionId(), outcome.value().summary()));
    }
}
