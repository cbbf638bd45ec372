package com.escrowswap.domain;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Store for pending transactions. Implementations must serialize mutations.
 */
public interface PendingTransactionRepository {

    PendingTransaction insert(PendingTransaction transaction);

    Optional<PendingTransaction> findById(String id);

    /** All transactions in creation order. */
    List<PendingTransaction> findAll();

    List<PendingTransaction> findByStatus(PendingTransactionStatus status);

    Optional<PendingTransaction> replace(String id, UnaryOperator<PendingTransaction> update);

    int count();
}
