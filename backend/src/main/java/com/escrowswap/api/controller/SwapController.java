package com.escrowswap.api.controller;

import com.escrowswap.api.dto.ErrorBody;
import com.escrowswap.api.dto.InitiateSwapRequest;
import com.escrowswap.api.dto.InitiateSwapResponse;
import com.escrowswap.domain.ChainId;
import com.escrowswap.swap.error.SwapOutcome;
import com.escrowswap.swap.orchestrator.SwapInitiation;
import com.escrowswap.swap.orchestrator.SwapOrchestrator;
import com.escrowswap.swap.orchestrator.SwapRequest;
import com.escrowswap.swap.orchestrator.WalletSession;
import com.escrowswap.swap.receipt.SwapReceipt;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;

/**
 * POST /swaps starts a swap for the caller's wallet; GET /swaps/receipt renders one (most recent by default).
 * Chain reads block, so swap initiation runs on the bounded-elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/swaps")
@RequiredArgsConstructor
public class SwapController {

    private final SwapOrchestrator swapOrchestrator;

    @PostMapping
    public Mono<ResponseEntity<?>> initiate(
            @RequestHeader(name = WalletHeaders.ADDRESS, required = false) String walletAddress,
            @RequestHeader(name = WalletHeaders.CHAIN, required = false) String walletChain,
            @RequestBody @Valid InitiateSwapRequest request) {
        Optional<ChainId> activeChain = ChainId.fromName(walletChain);
        if (walletChain != null && !walletChain.isBlank() && activeChain.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_NETWORK", "Unsupported network: " + walletChain)));
        }
        WalletSession session = new WalletSession(walletAddress, activeChain.orElse(null));
        SwapRequest swapRequest = new SwapRequest(
                request.sourceChain(),
                request.sourceToken(),
                request.targetChain(),
                request.targetToken(),
                request.amount(),
                request.recipientAddress());
        return Mono.<ResponseEntity<?>>fromCallable(() -> toResponse(swapOrchestrator.initiateSwap(session, swapRequest)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/receipt")
    public ResponseEntity<?> receipt(@RequestParam(required = false) String swapId) {
        SwapOutcome<SwapReceipt> outcome = swapOrchestrator.getReceipt(swapId);
        if (!outcome.isSuccess()) {
            return SwapErrorResponses.toResponse(outcome.error());
        }
        return ResponseEntity.ok(outcome.value());
    }

    private static ResponseEntity<?> toResponse(SwapOutcome<SwapInitiation> outcome) {
        if (!outcome.isSuccess()) {
            return SwapErrorResponses.toResponse(outcome.error());
        }
        SwapInitiation s = outcome.value();
        return ResponseEntity.status(HttpStatus.CREATED).body(new InitiateSwapResponse(
                s.swapId(), s.pendingTransactionId(), s.status().name(), s.targetAmount(), s.targetTxHash(), s.summary()));
    }
}
