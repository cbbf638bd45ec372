package com.escrowswap.swap.error;

/**
 * Carries a {@link SwapError} out of a component; the orchestrator turns it back into a failed outcome.
 */
public class SwapException extends RuntimeException {

    private final SwapError error;

    public SwapException(SwapError error) {
        super(error.message());
        this.error = error;
    }

    public SwapException(SwapError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public SwapError getError() {
        return error;
    }
}
