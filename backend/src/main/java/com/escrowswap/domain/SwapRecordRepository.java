package com.escrowswap.domain;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Store for swap records. Implementations must serialize mutations.
 */
public interface SwapRecordRepository {

    /**
     * Adds a new record. Throws IllegalStateException when the id already exists.
     */
    SwapRecord insert(SwapRecord record);

    Optional<SwapRecord> findById(String swapId);

    /** Last inserted record, by insertion order. */
    Optional<SwapRecord> findLast();

    Optional<SwapRecord> findByPendingTransactionId(String pendingTransactionId);

    /** Every record carrying {@code sourceTxHash} (case-insensitive), in insertion order. */
    List<SwapRecord> findAllBySourceTxHash(String sourceTxHash);

    /**
     * Atomically sets the record's sourceTxHash. Throws IllegalStateException when another record already carries
     * the same hash; empty when the id is unknown.
     */
    Optional<SwapRecord> linkSourceTxHash(String swapId, String sourceTxHash);

    List<SwapRecord> findByStatus(SwapStatus status);

    /**
     * Atomically replaces the stored record with {@code update.apply(current)}. Empty when the id is unknown.
     */
    Optional<SwapRecord> replace(String swapId, UnaryOperator<SwapRecord> update);

    int count();
}
