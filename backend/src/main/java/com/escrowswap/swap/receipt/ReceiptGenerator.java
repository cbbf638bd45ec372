package com.escrowswap.swap.receipt;

import com.escrowswap.domain.ChainId;
import com.escrowswap.domain.SwapRecord;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Renders swap records. Pure; amounts, addresses and hashes are copied verbatim.
 */
@Component
public class ReceiptGenerator {

    private static final Pattern TX_HASH = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    public SwapReceipt render(SwapRecord record) {
        ReceiptLeg source = leg(record.sourceChain(), record.sourceToken(), record.sourceAmount(),
                record.senderAddress(), record.sourceTxHash());
        ReceiptLeg target = leg(record.targetChain(), record.targetToken(), record.targetAmount(),
                record.recipientAddress(), record.targetTxHash());
        String message = message(record);
        return new SwapReceipt(record.swapId(), record.status(), message, source, target, record.timestamp(),
                record.failureReason(), text(record, source, target, message));
    }

    public static boolean isChainHash(String hash) {
        return hash != null && TX_HASH.matcher(hash).matches();
    }

    private static ReceiptLeg leg(ChainId chain, String token, String amount, String address, String hash) {
        return new ReceiptLeg(chain, chain.displayName(), token, amount, address, hash,
                isChainHash(hash) ? chain.explorerLink(hash) : null);
    }

    private static String message(SwapRecord record) {
        return switch (record.status()) {
            case PENDING -> "Your swap is awaiting confirmation. The " + record.targetToken() + " payout on "
                    + record.targetChain().displayName() + " is sent once the source transfer is confirmed.";
            case COMPLETED -> "Swap completed successfully. " + record.targetAmount() + " " + record.targetToken()
                    + " was sent to " + record.recipientAddress() + ".";
            case FAILED -> "Swap failed." + (record.failureReason() != null ? " Reason: " + record.failureReason() : "")
                    + " Contact support with the swap id if funds were transferred.";
        };
    }

    private static String text(SwapRecord record, ReceiptLeg source, ReceiptLeg target, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("Swap Receipt ").append(record.swapId()).append('\n');
        sb.append("Created: ").append(record.timestamp()).append('\n');
        appendLeg(sb, "From", source);
        appendLeg(sb, "To", target);
        sb.append("Status: ").append(record.status().name()).append('\n');
        sb.append(message);
        return sb.toString();
    }

    private static void appendLeg(StringBuilder sb, String label, ReceiptLeg leg) {
        sb.append(label).append(": ").append(leg.amount()).append(' ').append(leg.token())
                .append(" on ").append(leg.chainName()).append('\n');
        sb.append("  Address: ").append(leg.address()).append('\n');
        sb.append("  Transaction: ").append(leg.hash() != null ? leg.hash() : "pending");
        if (leg.explorerUrl() != null) {
            sb.append(" (").append(leg.explorerUrl()).append(')');
        }
        sb.append('\n');
    }
}
