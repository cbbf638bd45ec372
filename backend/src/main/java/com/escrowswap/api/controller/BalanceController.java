package com.escrowswap.api.controller;

import com.escrowswap.api.dto.BalancesResponse;
import com.escrowswap.api.dto.ErrorBody;
import com.escrowswap.api.validation.AddressValidator;
import com.escrowswap.domain.ChainId;
import com.escrowswap.swap.balance.BalanceQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;

/**
 * GET /balances/{address}: native and token balances across chains (all configured chains by default).
 */
@RestController
@RequestMapping("/api/v1/balances")
@RequiredArgsConstructor
public class BalanceController {

    private final AddressValidator addressValidator;
    private final BalanceQueryService balanceQueryService;

    @GetMapping("/{address}")
    public Mono<ResponseEntity<?>> balances(@PathVariable String address,
                                            @RequestParam(required = false) String chains) {
        if (!addressValidator.isValidAddress(address)) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid wallet address")));
        }
        Optional<List<ChainId>> parsed = addressValidator.parseChains(chains);
        if (parsed.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_NETWORK", "Unsupported network in: " + chains)));
        }
        String addr = address.trim();
        return Mono.<ResponseEntity<?>>fromCallable(() -> ResponseEntity.ok(new BalancesResponse(addr, balanceQueryService.balances(addr, parsed.get()))))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
