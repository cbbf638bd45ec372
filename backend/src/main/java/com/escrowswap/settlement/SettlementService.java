package com.escrowswap.settlement;

import com.escrowswap.chain.ChainClient;
import com.escrowswap.chain.ChainClientRegistry;
import com.escrowswap.chain.ChainTransaction;
import com.escrowswap.chain.EscrowSigner;
import com.escrowswap.chain.RpcException;
import com.escrowswap.chain.SignedTransfer;
import com.escrowswap.chain.TransactionConfirmation;
import com.escrowswap.chain.evm.Erc20Calls;
import com.escrowswap.common.Amounts;
import com.escrowswap.domain.SwapRecord;
import com.escrowswap.domain.SwapStatus;
import com.escrowswap.domain.TokenRef;
import com.escrowswap.domain.TokenRegistry;
import com.escrowswap.swap.ledger.SwapLedger;
import com.escrowswap.swap.receipt.ReceiptGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Payout leg of pending swaps: once the source transfer is confirmed on its chain and matches the swap (sender,
 * escrow, amount), the escrow pays the recipient on the target chain and the swap is marked COMPLETED.
 * <p>
 * A payout is signed once. Its hash goes on the swap record before the broadcast; from then on each pass only
 * reads that hash's receipt and, while the chain does not know it, re-sends the same signed bytes.
 * <p>
 * Reverted or mismatching source transfers, a source hash shared with an earlier swap, expired swaps and payouts
 * that cannot be signed end as FAILED. Anything transient (chain unavailable, escrow short of funds or gas) is
 * left PENDING for the next pass.
 */
@Slf4j
@Service
public class SettlementService {

    enum Outcome { COMPLETED, FAILED, WAITING, DEFERRED }

    private final SwapLedger swapLedger;
    private final ChainClientRegistry chainClientRegistry;
    private final EscrowSigner escrowSigner;
    private final TokenRegistry tokenRegistry;
    private final SettlementProperties properties;
    private final Clock clock;
    private final Map<String, Integer> failedAttemptsBySwap = new ConcurrentHashMap<>();
    // swapId -> payout signed for it; the ledger holds the hash
    private final Map<String, SignedTransfer> signedPayoutsBySwap = new ConcurrentHashMap<>();

    public SettlementService(SwapLedger swapLedger,
                             ChainClientRegistry chainClientRegistry,
                             EscrowSigner escrowSigner,
                             TokenRegistry tokenRegistry,
                             SettlementProperties properties,
                             Clock clock) {
        this.swapLedger = swapLedger;
        this.chainClientRegistry = chainClientRegistry;
        this.escrowSigner = escrowSigner;
        this.tokenRegistry = tokenRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    public SettlementReport settlePendingSwaps() {
        if (!escrowSigner.isAvailable()) {
            log.debug("Settlement skipped: no escrow signer");
            return SettlementReport.EMPTY;
        }
        int completed = 0;
        int failed = 0;
        int waiting = 0;
        int deferred = 0;
        for (SwapRecord swap : swapLedger.pending()) {
            switch (settle(swap)) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case WAITING -> waiting++;
                case DEFERRED -> deferred++;
            }
        }
        SettlementReport report = new SettlementReport(completed, failed, waiting, deferred);
        if (completed + failed + deferred > 0) {
            log.info("Settlement pass: {}", report);
        }
        return report;
    }

    Outcome settle(SwapRecord swap) {
        Optional<ChainClient> targetClient = chainClientRegistry.find(swap.targetChain());
        if (swap.targetTxHash() != null) {
            if (targetClient.isEmpty()) {
                return Outcome.DEFERRED;
            }
            return followPayout(swap, targetClient.get());
        }

        Instant now = clock.instant();
        if (swap.timestamp().plus(properties.getExpireAfter()).isBefore(now)) {
            return fail(swap, "Expired after " + properties.getExpireAfter() + " without settlement");
        }
        if (!ReceiptGenerator.isChainHash(swap.sourceTxHash())) {
            return Outcome.WAITING;
        }
        List<SwapRecord> claimants = swapLedger.findAllBySourceTxHash(swap.sourceTxHash());
        if (!claimants.isEmpty() && !claimants.get(0).swapId().equals(swap.swapId())) {
            return fail(swap, "Source transaction " + swap.sourceTxHash() + " already belongs to swap "
                    + claimants.get(0).swapId());
        }
        Optional<ChainClient> sourceClient = chainClientRegistry.find(swap.sourceChain());
        if (sourceClient.isEmpty() || targetClient.isEmpty()) {
            log.warn("Swap {} cannot settle: no chain client for {} or {}", swap.swapId(), swap.sourceChain(), swap.targetChain());
            return Outcome.DEFERRED;
        }
        Optional<TokenRef> sourceToken = tokenRegistry.find(swap.sourceChain(), swap.sourceToken());
        Optional<TokenRef> targetToken = tokenRegistry.find(swap.targetChain(), swap.targetToken());
        if (sourceToken.isEmpty() || targetToken.isEmpty()) {
            return fail(swap, "Unknown token " + swap.sourceToken() + " on " + swap.sourceChain() + " or "
                    + swap.targetToken() + " on " + swap.targetChain());
        }

        TransactionConfirmation confirmation;
        Optional<ChainTransaction> sourceTx;
        try {
            confirmation = sourceClient.get().getConfirmation(swap.sourceTxHash());
            if (confirmation.state() != TransactionConfirmation.State.SUCCEEDED
                    || confirmation.confirmations() < properties.getRequiredConfirmations()) {
                return confirmation.state() == TransactionConfirmation.State.REVERTED
                        ? fail(swap, "Source transfer " + swap.sourceTxHash() + " reverted")
                        : Outcome.WAITING;
            }
            sourceTx = sourceClient.get().getTransaction(swap.sourceTxHash());
        } catch (RpcException e) {
            log.warn("Swap {}: source transfer lookup failed on {}: {}", swap.swapId(), swap.sourceChain(), e.getMessage());
            return Outcome.DEFERRED;
        }
        if (sourceTx.isEmpty()) {
            return Outcome.WAITING;
        }
        if (!paysEscrow(sourceTx.get(), swap, sourceToken.get())) {
            return fail(swap, "Source transaction " + swap.sourceTxHash() + " is not a transfer of "
                    + swap.sourceAmount() + " " + swap.sourceToken() + " from " + swap.senderAddress()
                    + " to the escrow");
        }

        return payOut(swap, targetToken.get(), targetClient.get());
    }

    /** The sender's transaction moves at least the swap's source amount of the source token to the escrow. */
    private boolean paysEscrow(ChainTransaction tx, SwapRecord swap, TokenRef token) {
        if (!swap.senderAddress().equalsIgnoreCase(tx.from())) {
            return false;
        }
        BigInteger required = Amounts.toBaseUnits(new BigDecimal(swap.sourceAmount()), token.decimals());
        String escrow = escrowSigner.address();
        if (token.isNative()) {
            return escrow.equalsIgnoreCase(tx.to()) && tx.value().compareTo(required) >= 0;
        }
        return token.address().equalsIgnoreCase(tx.to())
                && Erc20Calls.decodeTransfer(tx.input())
                .filter(t -> escrow.equalsIgnoreCase(t.to()) && t.amount().compareTo(required) >= 0)
                .isPresent();
    }

    private Outcome payOut(SwapRecord swap, TokenRef token, ChainClient client) {
        BigInteger amount = Amounts.toBaseUnits(new BigDecimal(swap.targetAmount()), token.decimals());
        BigInteger minGas = Amounts.toBaseUnits(properties.getMinGasBalance(), 18);
        try {
            BigInteger gas = client.getBalance(escrowSigner.address());
            if (gas.compareTo(minGas) < 0) {
                log.error("Swap {}: escrow gas too low on {} ({} < {} native); payout deferred",
                        swap.swapId(), swap.targetChain(), Amounts.toDisplay(gas, 18), Amounts.toDisplay(properties.getMinGasBalance()));
                return Outcome.DEFERRED;
            }
            BigInteger available = client.readBalance(token, escrowSigner.address());
            if (available.compareTo(amount) < 0) {
                log.error("Swap {}: escrow holds {} {} on {}, payout needs {}; payout deferred",
                        swap.swapId(), Amounts.toDisplay(available, token.decimals()), token.symbol(),
                        swap.targetChain(), swap.targetAmount());
                return Outcome.DEFERRED;
            }
        } catch (RpcException e) {
            log.warn("Swap {}: escrow balance read failed on {}: {}", swap.swapId(), swap.targetChain(), e.getMessage());
            return Outcome.DEFERRED;
        }

        SignedTransfer payout;
        try {
            payout = client.signTransfer(token.address(), swap.recipientAddress(), amount, escrowSigner);
        } catch (RpcException e) {
            int attempts = failedAttemptsBySwap.merge(swap.swapId(), 1, Integer::sum);
            log.error("Swap {}: payout attempt {}/{} could not be signed on {}: {}",
                    swap.swapId(), attempts, properties.getMaxAttempts(), swap.targetChain(), e.getMessage());
            if (attempts >= properties.getMaxAttempts()) {
                return fail(swap, "Payout failed after " + attempts + " attempts: " + e.getMessage());
            }
            return Outcome.DEFERRED;
        }
        signedPayoutsBySwap.put(swap.swapId(), payout);
        swapLedger.updateStatus(swap.swapId(), SwapStatus.PENDING, null, payout.hash());

        try {
            client.broadcast(payout);
        } catch (RpcException e) {
            log.warn("Swap {}: broadcast of payout {} failed on {}: {}; its receipt is checked before re-sending",
                    swap.swapId(), payout.hash(), swap.targetChain(), e.getMessage());
            return Outcome.DEFERRED;
        }
        return complete(swap, token.symbol(), payout.hash());
    }

    /** A payout was signed on an earlier pass: never sign again, only confirm or re-send the same bytes. */
    private Outcome followPayout(SwapRecord swap, ChainClient client) {
        String hash = swap.targetTxHash();
        TransactionConfirmation confirmation;
        try {
            confirmation = client.getConfirmation(hash);
        } catch (RpcException e) {
            log.warn("Swap {}: payout receipt lookup failed on {}: {}", swap.swapId(), swap.targetChain(), e.getMessage());
            return Outcome.DEFERRED;
        }
        switch (confirmation.state()) {
            case SUCCEEDED:
                return complete(swap, swap.targetToken(), hash);
            case REVERTED:
                return fail(swap, "Payout " + hash + " reverted on " + swap.targetChain());
            case UNKNOWN:
            default:
                break;
        }
        SignedTransfer payout = signedPayoutsBySwap.get(swap.swapId());
        if (payout == null || !payout.hash().equalsIgnoreCase(hash)) {
            log.warn("Swap {}: payout {} not found on {} and no signed copy is held; waiting for it", swap.swapId(), hash,
                    swap.targetChain());
            return Outcome.WAITING;
        }
        try {
            client.broadcast(payout);
            log.info("Swap {}: payout {} re-sent on {}", swap.swapId(), hash, swap.targetChain());
        } catch (RpcException e) {
            log.warn("Swap {}: re-sending payout {} failed on {}: {}", swap.swapId(), hash, swap.targetChain(), e.getMessage());
        }
        return Outcome.WAITING;
    }

    private Outcome complete(SwapRecord swap, String tokenSymbol, String payoutHash) {
        swapLedger.updateStatus(swap.swapId(), SwapStatus.COMPLETED, null, payoutHash);
        failedAttemptsBySwap.remove(swap.swapId());
        signedPayoutsBySwap.remove(swap.swapId());
        log.info("Swap {} settled: {} {} sent to {} on {} in {}",
                swap.swapId(), swap.targetAmount(), tokenSymbol, swap.recipientAddress(), swap.targetChain(), payoutHash);
        return Outcome.COMPLETED;
    }

    private Outcome fail(SwapRecord swap, String reason) {
        swapLedger.fail(swap.swapId(), reason);
        failedAttemptsBySwap.remove(swap.swapId());
        signedPayoutsBySwap.remove(swap.swapId());
        return Outcome.FAILED;
    }
}
