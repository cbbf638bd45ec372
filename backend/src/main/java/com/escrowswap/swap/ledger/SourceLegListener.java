package com.escrowswap.swap.ledger;

import com.escrowswap.domain.PendingTransaction;
import com.escrowswap.domain.PendingTransactionStatus;
import com.escrowswap.domain.PendingTransactionUpdatedEvent;
import com.escrowswap.domain.SwapRecord;
import com.escrowswap.domain.SwapStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Follows the source leg of a swap through its pending transaction: a reported broadcast hash becomes the swap's
 * sourceTxHash, a rejected signature fails the swap. A hash already used by another swap fails this one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceLegListener {

    private final SwapLedger swapLedger;

    @EventListener
    public void onPendingTransactionUpdated(PendingTransactionUpdatedEvent event) {
        PendingTransaction tx = event.transaction();
        Optional<SwapRecord> swap = swapLedger.findByPendingTransactionId(tx.id());
        if (swap.isEmpty()) {
            return;
        }
        SwapRecord record = swap.get();
        if (record.status() != SwapStatus.PENDING) {
            // same-chain swaps are already settled; only the hash is worth keeping
            if (tx.hash() != null) {
                try {
                    swapLedger.linkSourceTxHash(record.swapId(), tx.hash());
                } catch (IllegalStateException e) {
                    log.warn("Swap {} ({}): {}", record.swapId(), record.status(), e.getMessage());
                }
            }
            return;
        }
        if (tx.status() == PendingTransactionStatus.REJECTED) {
            swapLedger.fail(record.swapId(), "Source transfer " + tx.id() + " was rejected by the signer");
            return;
        }
        if (tx.hash() != null) {
            try {
                swapLedger.linkSourceTxHash(record.swapId(), tx.hash());
                log.debug("Swap {} source leg broadcast as {}", record.swapId(), tx.hash());
            } catch (IllegalStateException e) {
                swapLedger.fail(record.swapId(), e.getMessage());
            }
        }
    }
}
