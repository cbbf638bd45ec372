package com.escrowswap.swap.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a caller-facing swap operation: exactly one of value or error is set.
 */
public record SwapOutcome<T>(T value, SwapError error) {

    public SwapOutcome {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value or error must be set");
        }
    }

    public static <T> SwapOutcome<T> success(T value) {
        return new SwapOutcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> SwapOutcome<T> failure(SwapError error) {
        return new SwapOutcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public <R> SwapOutcome<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error);
    }
}
