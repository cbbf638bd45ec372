package com.escrowswap.chain.evm;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * ERC-20 call data.
 */
public final class Erc20Calls {

    private static final String TRANSFER_SELECTOR = "0xa9059cbb";
    // selector + two 32-byte words
    private static final int TRANSFER_INPUT_LENGTH = TRANSFER_SELECTOR.length() + 128;

    private Erc20Calls() {
    }

    /** balanceOf(address): selector 0x70a08231 + left-padded address. */
    public static String balanceOf(String owner) {
        return FunctionEncoder.encode(new Function("balanceOf", List.of(new Address(owner)), Collections.emptyList()));
    }

    /** transfer(address,uint256): selector 0xa9059cbb. */
    public static String transfer(String to, BigInteger amount) {
        return FunctionEncoder.encode(new Function(
                "transfer",
                List.of(new Address(to), new Uint256(amount)),
                Collections.emptyList()));
    }

    /**
     * Recipient and amount of a transfer(address,uint256) call; empty for any other call data.
     */
    public static Optional<Transfer> decodeTransfer(String input) {
        if (input == null || input.length() != TRANSFER_INPUT_LENGTH
                || !input.toLowerCase(Locale.ROOT).startsWith(TRANSFER_SELECTOR)) {
            return Optional.empty();
        }
        String addressWord = input.substring(TRANSFER_SELECTOR.length(), TRANSFER_SELECTOR.length() + 64);
        String amountWord = input.substring(TRANSFER_SELECTOR.length() + 64);
        if (!addressWord.startsWith("000000000000000000000000")) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Transfer("0x" + addressWord.substring(24), new BigInteger(amountWord, 16)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public record Transfer(String to, BigInteger amount) {
    }
}
