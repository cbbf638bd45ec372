package com.escrowswap.store;

import com.escrowswap.domain.PendingTransaction;
import com.escrowswap.domain.PendingTransactionRepository;
import com.escrowswap.domain.PendingTransactionStatus;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Process-local pending transaction store; synchronized.
 */
@Repository
public class InMemoryPendingTransactionRepository implements PendingTransactionRepository {

    private final Map<String, PendingTransaction> transactionsById = new LinkedHashMap<>();

    @Override
    public synchronized PendingTransaction insert(PendingTransaction transaction) {
        Objects.requireNonNull(transaction, "transaction");
        if (transactionsById.containsKey(transaction.id())) {
            throw new IllegalStateException("Transaction id already exists: " + transaction.id());
        }
        transactionsById.put(transaction.id(), transaction);
        return transaction;
    }

    @Override
    public synchronized Optional<PendingTransaction> findById(String id) {
        return Optional.ofNullable(transactionsById.get(id));
    }

    @Override
    public synchronized List<PendingTransaction> findAll() {
        return new ArrayList<>(transactionsById.values());
    }

    @Override
    public synchronized List<PendingTransaction> findByStatus(PendingTransactionStatus status) {
        return transactionsById.values().stream().filter(t -> t.status() == status).toList();
    }

    @Override
    public synchronized Optional<PendingTransaction> replace(String id, UnaryOperator<PendingTransaction> update) {
        PendingTransaction current = transactionsById.get(id);
        if (current == null) {
            return Optional.empty();
        }
        PendingTransaction updated = update.apply(current);
        transactionsById.put(id, updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized int count() {
        return transactionsById.size();
    }
}
