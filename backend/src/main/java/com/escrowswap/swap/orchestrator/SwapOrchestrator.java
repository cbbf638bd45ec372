package com.escrowswap.swap.orchestrator;

import com.escrowswap.chain.ChainClientRegistry;
import com.escrowswap.chain.EscrowSigner;
import com.escrowswap.chain.RpcException;
import com.escrowswap.chain.evm.Erc20Calls;
import com.escrowswap.common.Amounts;
import com.escrowswap.common.EvmAddresses;
import com.escrowswap.domain.ChainId;
import com.escrowswap.domain.SwapRecord;
import com.escrowswap.domain.SwapStatus;
import com.escrowswap.domain.TokenRef;
import com.escrowswap.domain.TokenRegistry;
import com.escrowswap.swap.balance.BalanceVerifier;
import com.escrowswap.swap.config.SwapProperties;
import com.escrowswap.swap.error.SwapError;
import com.escrowswap.swap.error.SwapErrorKind;
import com.escrowswap.swap.error.SwapException;
import com.escrowswap.swap.error.SwapOutcome;
import com.escrowswap.swap.ledger.SwapLedger;
import com.escrowswap.swap.rate.RateFeeTable;
import com.escrowswap.swap.receipt.ReceiptGenerator;
import com.escrowswap.swap.receipt.SwapReceipt;
import com.escrowswap.swap.tx.PendingTransactionTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Map;

/**
 * End-to-end swap workflow: validate → sender balance → convert → escrow balance → source-leg transfer → ledger.
 * <p>
 * Every check runs before the first mutation, so a failed swap leaves no pending transaction and no swap record.
 * Failures come back as {@link SwapOutcome#failure}; no exception crosses this boundary.
 * <p>
 * Cross-chain swaps are recorded PENDING and paid out later by settlement. Same-chain swaps, when synchronous
 * payout is enabled, are paid out with the escrow key right after the escrow check and recorded COMPLETED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SwapOrchestrator {

    private final TokenRegistry tokenRegistry;
    private final RateFeeTable rateFeeTable;
    private final BalanceVerifier balanceVerifier;
    private final PendingTransactionTracker pendingTransactionTracker;
    private final SwapLedger swapLedger;
    private final ReceiptGenerator receiptGenerator;
    private final ChainClientRegistry chainClientRegistry;
    private final EscrowSigner escrowSigner;
    private final SwapProperties swapProperties;
    private final Clock clock;

    public SwapOutcome<SwapInitiation> initiateSwap(WalletSession session, SwapRequest request) {
        try {
            return SwapOutcome.success(runSwap(session, request));
        } catch (SwapException e) {
            log.info("Swap rejected ({}): {}", e.getError().kind(), e.getError().message());
            return SwapOutcome.failure(e.getError());
        }
    }

    /**
     * Receipt for {@code swapId}, or for the most recent swap when {@code swapId} is null or blank.
     */
    public SwapOutcome<SwapReceipt> getReceipt(String swapId) {
        if (swapId == null || swapId.isBlank()) {
            return swapLedger.mostRecent()
                    .map(receiptGenerator::render)
                    .map(SwapOutcome::success)
                    .orElseGet(() -> SwapOutcome.failure(SwapError.notFound("No swaps found")));
        }
        return swapLedger.findById(swapId.trim())
                .map(receiptGenerator::render)
                .map(SwapOutcome::success)
                .orElseGet(() -> SwapOutcome.failure(SwapError.notFound("Swap " + swapId.trim() + " not found")));
    }

    /**
     * Liquidity provision: validate → sender balance → transfer to escrow. No target leg, no ledger entry.
     */
    public SwapOutcome<EscrowDeposit> createEscrowDeposit(WalletSession session, ChainId chain, String tokenSymbol,
                                                         String amount) {
        try {
            String sender = requireSender(session);
            TokenRef token = resolveToken(chain, tokenSymbol);
            BigDecimal parsed = validateAmount(amount, token);
            balanceVerifier.requireBalance(token, sender, parsed);
            String txId = createTransferToEscrow(token, parsed, sender);
            String summary = "Deposit of " + Amounts.toDisplay(parsed) + " " + token.symbol() + " on "
                    + chain.displayName() + " to escrow " + escrowSigner.address()
                    + " is ready. Sign pending transaction " + txId + " in your wallet.";
            log.info("Escrow deposit {} created: {} {} on {} from {}", txId, parsed, token.symbol(), chain, sender);
            return SwapOutcome.success(new EscrowDeposit(txId, summary));
        } catch (SwapException e) {
            log.info("Escrow deposit rejected ({}): {}", e.getError().kind(), e.getError().message());
            return SwapOutcome.failure(e.getError());
        }
    }

    private SwapInitiation runSwap(WalletSession session, SwapRequest request) {
        String sender = requireSender(session);
        TokenRef source = resolveToken(request.sourceChain(), request.sourceToken());
        TokenRef target = resolveToken(request.targetChain(), request.targetToken());
        if (rateFeeTable.rate(source, target).isEmpty()) {
            throw new SwapException(SwapError.unsupportedPair(source.key(), target.key()));
        }
        BigDecimal amount = validateAmount(request.amount(), source);
        String recipient = resolveRecipient(request.recipientAddress(), sender);
        boolean syncPayout = request.sourceChain() == request.targetChain() && swapProperties.isSyncPayoutEnabled();
        if (syncPayout && session.activeChain() != request.sourceChain()) {
            throw new SwapException(SwapError.wrongNetwork(request.sourceChain(), session.activeChain()));
        }

        balanceVerifier.requireBalance(source, sender, amount);

        BigDecimal targetAmount = rateFeeTable.convert(amount, source, target);
        if (targetAmount.signum() <= 0) {
            throw new SwapException(SwapError.invalidAmount(request.amount(),
                    Amounts.toPlain(swapProperties.getMinAmount()), Amounts.toPlain(swapProperties.getMaxAmount()),
                    source.symbol()));
        }

        balanceVerifier.requireEscrowBalance(target, escrowSigner.address(), targetAmount);

        String payoutHash = syncPayout ? payOut(target, recipient, targetAmount) : null;

        String txId = createTransferToEscrow(source, amount, sender);
        SwapStatus status = syncPayout ? SwapStatus.COMPLETED : SwapStatus.PENDING;
        SwapRecord record = new SwapRecord(
                swapLedger.nextSwapId(),
                source.chainId(),
                target.chainId(),
                source.symbol(),
                target.symbol(),
                request.amount().trim(),
                targetAmount.toPlainString(),
                sender,
                recipient,
                txId,
                txId,
                payoutHash,
                status,
                clock.instant(),
                null);
        swapLedger.append(record);
        return new SwapInitiation(record.swapId(), txId, status, record.targetAmount(), payoutHash,
                summary(record, txId));
    }

    private String requireSender(WalletSession session) {
        if (session == null || !EvmAddresses.isValid(session.address())) {
            throw new SwapException(SwapError.invalidAddress(session == null ? null : session.address()));
        }
        return session.address().trim();
    }

    private TokenRef resolveToken(ChainId chain, String symbol) {
        if (chain == null) {
            throw new SwapException(new SwapError(SwapErrorKind.UNSUPPORTED_PAIR, "Chain is required for " + symbol, Map.of()));
        }
        return tokenRegistry.find(chain, symbol)
                .orElseThrow(() -> new SwapException(SwapError.unsupportedToken(chain, symbol)));
    }

    private String resolveRecipient(String recipient, String sender) {
        if (recipient == null || recipient.isBlank()) {
            return sender;
        }
        if (!EvmAddresses.isValid(recipient)) {
            throw new SwapException(SwapError.invalidAddress(recipient));
        }
        return recipient.trim();
    }

    private BigDecimal validateAmount(String amount, TokenRef token) {
        BigDecimal min = swapProperties.getMinAmount();
        BigDecimal max = swapProperties.getMaxAmount();
        BigDecimal parsed = Amounts.parseDecimal(amount).orElse(null);
        if (parsed == null
                || parsed.signum() <= 0
                || parsed.compareTo(min) < 0
                || parsed.compareTo(max) > 0
                || Amounts.significantScale(parsed) > token.decimals()) {
            throw new SwapException(SwapError.invalidAmount(amount, Amounts.toPlain(min), Amounts.toPlain(max),
                    token.symbol()));
        }
        return parsed;
    }

    private String payOut(TokenRef token, String recipient, BigDecimal amount) {
        if (!escrowSigner.isAvailable()) {
            throw new SwapException(SwapError.transactionFailed("escrow signer is not configured"));
        }
        BigInteger baseUnits = Amounts.toBaseUnits(amount, token.decimals());
        try {
            String hash = chainClientRegistry.require(token.chainId())
                    .submitTransfer(token.address(), recipient, baseUnits, escrowSigner);
            log.info("Synchronous payout of {} {} on {} to {}: {}", amount, token.symbol(), token.chainId(), recipient, hash);
            return hash;
        } catch (RpcException e) {
            log.error("Synchronous payout of {} {} on {} to {} failed: {}",
                    amount, token.symbol(), token.chainId(), recipient, e.getMessage());
            throw new SwapException(SwapError.transactionFailed(e.getMessage()), e);
        }
    }

    private String createTransferToEscrow(TokenRef token, BigDecimal amount, String sender) {
        BigInteger baseUnits = Amounts.toBaseUnits(amount, token.decimals());
        if (token.isNative()) {
            return pendingTransactionTracker.create(escrowSigner.address(), baseUnits.toString(), null, sender,
                    token.chainId());
        }
        return pendingTransactionTracker.create(token.address(), "0",
                Erc20Calls.transfer(escrowSigner.address(), baseUnits), sender, token.chainId());
    }

    private String summary(SwapRecord record, String txId) {
        String header = record.sourceAmount() + " " + record.sourceToken() + " on " + record.sourceChain().displayName()
                + " -> " + record.targetAmount() + " " + record.targetToken() + " on "
                + record.targetChain().displayName() + " (fee " + rateFeeTable.feePercent().toPlainString() + "%)";
        if (record.status() == SwapStatus.COMPLETED) {
            return "Swap completed: " + header + ". Payout transaction " + record.targetTxHash()
                    + " sent to " + record.recipientAddress() + ". Sign pending transaction " + txId
                    + " to send your " + record.sourceToken() + " to the escrow. Swap id: " + record.swapId() + ".";
        }
        return "Swap initiated: " + header + ". Sign pending transaction " + txId + " to send "
                + record.sourceAmount() + " " + record.sourceToken() + " to the escrow wallet "
                + escrowSigner.address() + ". The " + record.targetToken() + " payout to "
                + record.recipientAddress() + " on " + record.targetChain().displayName()
                + " is sent asynchronously once your transfer is confirmed. Swap id: " + record.swapId() + ".";
    }
}
