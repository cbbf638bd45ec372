package com.escrowswap.store;

import com.escrowswap.domain.SwapRecord;
import com.escrowswap.domain.SwapRecordRepository;
import com.escrowswap.domain.SwapStatus;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Process-local swap store. Insertion order is kept for most-recent lookups; every access is synchronized.
 */
@Repository
public class InMemorySwapRecordRepository implements SwapRecordRepository {

    // key: swapId, in insertion order
    private final Map<String, SwapRecord> recordsById = new LinkedHashMap<>();

    private SwapRecord last;

    @Override
    public synchronized SwapRecord insert(SwapRecord record) {
        Objects.requireNonNull(record, "record");
        if (recordsById.containsKey(record.swapId())) {
            throw new IllegalStateException("Swap id already exists: " + record.swapId());
        }
        recordsById.put(record.swapId(), record);
        last = record;
        return record;
    }

    @Override
    public synchronized Optional<SwapRecord> findById(String swapId) {
        return Optional.ofNullable(recordsById.get(swapId));
    }

    @Override
    public synchronized Optional<SwapRecord> findLast() {
        if (last == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(recordsById.get(last.swapId()));
    }

    @Override
    public synchronized Optional<SwapRecord> findByPendingTransactionId(String pendingTransactionId) {
        if (pendingTransactionId == null) {
            return Optional.empty();
        }
        return recordsById.values().stream()
                .filter(r -> pendingTransactionId.equals(r.pendingTransactionId()))
                .findFirst();
    }

    @Override
    public synchronized List<SwapRecord> findAllBySourceTxHash(String sourceTxHash) {
        if (sourceTxHash == null) {
            return List.of();
        }
        return recordsById.values().stream()
                .filter(r -> sourceTxHash.equalsIgnoreCase(r.sourceTxHash()))
                .toList();
    }

    @Override
    public synchronized Optional<SwapRecord> linkSourceTxHash(String swapId, String sourceTxHash) {
        Objects.requireNonNull(sourceTxHash, "sourceTxHash");
        SwapRecord current = recordsById.get(swapId);
        if (current == null) {
            return Optional.empty();
        }
        for (SwapRecord other : recordsById.values()) {
            if (!other.swapId().equals(swapId) && sourceTxHash.equalsIgnoreCase(other.sourceTxHash())) {
                throw new IllegalStateException("Source transaction " + sourceTxHash + " already belongs to swap "
                        + other.swapId());
            }
        }
        SwapRecord updated = current.withSourceTxHash(sourceTxHash);
        recordsById.put(swapId, updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized List<SwapRecord> findByStatus(SwapStatus status) {
        return recordsById.values().stream().filter(r -> r.status() == status).toList();
    }

    @Override
    public synchronized Optional<SwapRecord> replace(String swapId, UnaryOperator<SwapRecord> update) {
        SwapRecord current = recordsById.get(swapId);
        if (current == null) {
            return Optional.empty();
        }
        SwapRecord updated = update.apply(current);
        if (!current.swapId().equals(updated.swapId())) {
            throw new IllegalStateException("Swap id cannot change on update: " + swapId);
        }
        recordsById.put(swapId, updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized int count() {
        return recordsById.size();
    }
}
