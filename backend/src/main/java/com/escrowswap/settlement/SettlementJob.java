package com.escrowswap.settlement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic settlement pass over pending swaps. Fixed delay, so passes never overlap.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementJob {

    private final SettlementService settlementService;
    private final SettlementProperties settlementProperties;

    @Scheduled(
            fixedDelayString = "${escrowswap.settlement.interval-ms:30000}",
            initialDelayString = "${escrowswap.settlement.interval-ms:30000}")
    public void runScheduled() {
        if (!settlementProperties.isEnabled()) {
            return;
        }
        try {
            settlementService.settlePendingSwaps();
        } catch (RuntimeException e) {
            log.error("Settlement pass failed", e);
        }
    }
}
