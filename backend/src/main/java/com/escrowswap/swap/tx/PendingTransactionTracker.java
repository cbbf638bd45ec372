package com.escrowswap.swap.tx;

import com.escrowswap.common.IdGenerator;
import com.escrowswap.domain.ChainId;
import com.escrowswap.domain.ChainResolution;
import com.escrowswap.domain.PendingTransaction;
import com.escrowswap.domain.PendingTransactionRepository;
import com.escrowswap.domain.PendingTransactionStatus;
import com.escrowswap.domain.PendingTransactionUpdatedEvent;
import com.escrowswap.domain.TransactionDataType;
import com.escrowswap.domain.TransactionMetadata;
import com.escrowswap.domain.WalletSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Records unsigned transfer intents for an external signer and follows their status.
 * Never broadcasts; {@link #updateStatus} is the only mutation path after creation.
 */
@Slf4j
@Service
public class PendingTransactionTracker {

    private static final int NATIVE_DECIMALS = 18;

    private final PendingTransactionRepository repository;
    private final ChainInference chainInference;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final IdGenerator ids;

    public PendingTransactionTracker(PendingTransactionRepository repository,
                                     ChainInference chainInference,
                                     ApplicationEventPublisher eventPublisher,
                                     Clock clock) {
        this.repository = repository;
        this.chainInference = chainInference;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.ids = new IdGenerator("tx", clock);
    }

    /**
     * @param value         0x hex (kept), integer base units (kept) or a decimal native amount (scaled by 10^18)
     * @param data          optional call data
     * @param walletAddress signing wallet; when present the transaction is marked for frontend signature
     * @param chain         null to infer from {@code to}
     * @return id of the new PENDING transaction
     */
    public String create(String to, String value, String data, String walletAddress, ChainId chain) {
        if (to == null || to.isBlank()) {
            throw new IllegalArgumentException("Destination address is required");
        }
        String normalizedTo = withHexPrefix(to.trim());
        String normalizedData = data == null || data.isBlank() ? null : withHexPrefix(data.trim());
        ChainResolution resolution = chainInference.resolve(normalizedTo, chain);
        boolean frontend = walletAddress != null && !walletAddress.isBlank();
        TransactionMetadata metadata = new TransactionMetadata(
                frontend ? WalletSource.FRONTEND_WALLET : WalletSource.BACKEND_WALLET,
                frontend ? walletAddress.trim() : null,
                frontend,
                TransactionDataType.classify(normalizedData),
                resolution.chainId(),
                resolution.kind());
        Instant now = clock.instant();
        PendingTransaction transaction = new PendingTransaction(
                ids.next(), normalizedTo, normalizeValue(value), normalizedData,
                PendingTransactionStatus.PENDING, null, metadata, now, now);
        repository.insert(transaction);
        log.info("Pending transaction {} created: to {} on {} ({}), value {}",
                transaction.id(), normalizedTo, resolution.chainId(), resolution.kind(), transaction.value());
        return transaction.id();
    }

    /**
     * Applies a status reported by the external signer. Empty when the id is unknown.
     *
     * @throws IllegalStateException when the transaction is already REJECTED or COMPLETED and the status differs
     */
    public Optional<PendingTransaction> updateStatus(String id, PendingTransactionStatus status, String hash) {
        if (status == null) {
            throw new IllegalArgumentException("Status is required");
        }
        String normalizedHash = hash == null || hash.isBlank() ? null : withHexPrefix(hash.trim());
        Optional<PendingTransaction> updated = repository.replace(id, current -> {
            if (current.status().isTerminal() && current.status() != status) {
                throw new IllegalStateException("Transaction " + id + " is already " + current.status());
            }
            return current.withStatus(status, normalizedHash, clock.instant());
        });
        updated.ifPresent(tx -> {
            log.info("Pending transaction {} -> {}{}", id, status, tx.hash() != null ? " (" + tx.hash() + ")" : "");
            eventPublisher.publishEvent(new PendingTransactionUpdatedEvent(tx));
        });
        return updated;
    }

    public Optional<PendingTransaction> findById(String id) {
        return repository.findById(id);
    }

    /** All transactions when {@code status} is null, in creation order. */
    public List<PendingTransaction> list(PendingTransactionStatus status) {
        return status == null ? repository.findAll() : repository.findByStatus(status);
    }

    public int size() {
        return repository.count();
    }

    static String normalizeValue(String value) {
        if (value == null || value.isBlank()) {
            return "0";
        }
        String v = value.trim();
        if (v.startsWith("0x") || v.startsWith("0X")) {
            if (!v.substring(2).matches("[0-9a-fA-F]*")) {
                throw new IllegalArgumentException("Invalid hex value: " + value);
            }
            return v;
        }
        if (v.matches("\\d+")) {
            return v;
        }
        if (v.matches("\\d*\\.\\d+|\\d+\\.")) {
            return new BigDecimal(v).movePointRight(NATIVE_DECIMALS).setScale(0, RoundingMode.DOWN).toPlainString();
        }
        throw new IllegalArgumentException("Invalid transaction value: " + value);
    }

    private static String withHexPrefix(String value) {
        return value.startsWith("0x") || value.startsWith("0X") ? value : "0x" + value;
    }
}
