package com.escrowswap.swap.ledger;

import com.escrowswap.common.IdGenerator;
import com.escrowswap.domain.SwapRecord;
import com.escrowswap.domain.SwapRecordRepository;
import com.escrowswap.domain.SwapStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Append-only swap ledger. Records are never deleted; status changes replace the stored record.
 */
@Slf4j
@Service
public class SwapLedger {

    private final SwapRecordRepository repository;
    private final IdGenerator ids;

    public SwapLedger(SwapRecordRepository repository, Clock clock) {
        this.repository = repository;
        this.ids = new IdGenerator("swap", clock);
    }

    public String nextSwapId() {
        return ids.next();
    }

    /**
     * @throws IllegalStateException when a record with the same id exists
     */
    public SwapRecord append(SwapRecord record) {
        SwapRecord stored = repository.insert(record);
        log.info("Swap {} recorded as {}: {} {} on {} -> {} {} on {}",
                record.swapId(), record.status(), record.sourceAmount(), record.sourceToken(), record.sourceChain(),
                record.targetAmount(), record.targetToken(), record.targetChain());
        return stored;
    }

    public Optional<SwapRecord> findById(String swapId) {
        return swapId == null ? Optional.empty() : repository.findById(swapId);
    }

    /** The last appended record. */
    public Optional<SwapRecord> mostRecent() {
        return repository.findLast();
    }

    /** First swap, in ledger order, that carries {@code sourceTxHash}. */
    public Optional<SwapRecord> findBySourceTxHash(String sourceTxHash) {
        return repository.findAllBySourceTxHash(sourceTxHash).stream().findFirst();
    }

    public List<SwapRecord> findAllBySourceTxHash(String sourceTxHash) {
        return repository.findAllBySourceTxHash(sourceTxHash);
    }

    public Optional<SwapRecord> findByPendingTransactionId(String pendingTransactionId) {
        return repository.findByPendingTransactionId(pendingTransactionId);
    }

    /**
     * Attaches the broadcast hash of the source leg. One chain transaction pays for at most one swap.
     *
     * @throws IllegalStateException when another swap already carries {@code sourceTxHash}
     */
    public Optional<SwapRecord> linkSourceTxHash(String swapId, String sourceTxHash) {
        Optional<SwapRecord> updated = repository.linkSourceTxHash(swapId, sourceTxHash);
        updated.ifPresent(r -> log.debug("Swap {} source leg is {}", swapId, sourceTxHash));
        return updated;
    }

    /**
     * Merges the given fields into the stored record; null hashes leave the stored value unchanged.
     */
    public Optional<SwapRecord> updateStatus(String swapId, SwapStatus status, String sourceTxHash, String targetTxHash) {
        Optional<SwapRecord> updated = repository.replace(swapId, current -> {
            SwapRecord next = current.withStatus(status != null ? status : current.status());
            if (sourceTxHash != null) {
                next = next.withSourceTxHash(sourceTxHash);
            }
            if (targetTxHash != null) {
                next = next.withTargetTxHash(targetTxHash);
            }
            return next;
        });
        updated.ifPresent(r -> log.info("Swap {} -> {}", swapId, r.status()));
        return updated;
    }

    public Optional<SwapRecord> fail(String swapId, String reason) {
        Optional<SwapRecord> updated = repository.replace(swapId,
                current -> current.withStatus(SwapStatus.FAILED).withFailureReason(reason));
        updated.ifPresent(r -> log.warn("Swap {} failed: {}", swapId, reason));
        return updated;
    }

    public List<SwapRecord> pending() {
        return repository.findByStatus(SwapStatus.PENDING);
    }

    public int size() {
        return repository.count();
    }
}
