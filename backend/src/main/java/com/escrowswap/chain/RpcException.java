package com.escrowswap.chain;

/**
 * A chain call that did not produce a usable result.
 * <p>
 * {@link #isNodeError()} is true when the node answered with a JSON-RPC error, so the request was seen and
 * refused. Otherwise the failure happened in transport or after retries, and for a broadcast the node may still
 * have accepted the transaction.
 */
public class RpcException extends RuntimeException {

    private final boolean nodeError;

    public RpcException(String message) {
        this(message, null, false);
    }

    public RpcException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private RpcException(String message, Throwable cause, boolean nodeError) {
        super(message, cause);
        this.nodeError = nodeError;
    }

    /** The node's own JSON-RPC error message. */
    public static RpcException nodeError(String message) {
        return new RpcException(message, null, true);
    }

    public boolean isNodeError() {
        return nodeError;
    }
}
