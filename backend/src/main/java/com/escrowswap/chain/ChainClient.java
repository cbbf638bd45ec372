package com.escrowswap.chain;

import com.escrowswap.domain.ChainId;
import com.escrowswap.domain.TokenRef;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Read/write access to one chain. All amounts are integer base units.
 * Implementations carry their own retry and timeout policy and throw {@link RpcException} on failure.
 */
public interface ChainClient {

    ChainId chainId();

    /** Native balance of {@code address}. */
    BigInteger getBalance(String address);

    /** ERC-20 {@code balanceOf(address)} on {@code tokenAddress}. */
    BigInteger readTokenBalance(String tokenAddress, String address);

    /**
     * Builds and signs a transfer of {@code amount} to {@code to} without sending it. {@code tokenAddressOrNative}
     * is either an ERC-20 contract or {@link TokenRef#NATIVE_ADDRESS}.
     */
    SignedTransfer signTransfer(String tokenAddressOrNative, String to, BigInteger amount, EscrowSigner signer);

    /**
     * Sends a signed transfer once. A node that already knows the transaction counts as success.
     *
     * @return transaction hash
     */
    String broadcast(SignedTransfer transfer);

    /**
     * Signs and broadcasts in one step.
     *
     * @return transaction hash
     */
    default String submitTransfer(String tokenAddressOrNative, String to, BigInteger amount, EscrowSigner signer) {
        return broadcast(signTransfer(tokenAddressOrNative, to, amount, signer));
    }

    /** Empty when the node does not know the hash. */
    Optional<ChainTransaction> getTransaction(String txHash);

    TransactionConfirmation getConfirmation(String txHash);

    default BigInteger readBalance(TokenRef token, String address) {
        return token.isNative() ? getBalance(address) : readTokenBalance(token.address(), address);
    }
}
