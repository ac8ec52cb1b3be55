package com.deepansh.memory.core;

import java.util.Objects;

/**
 * Outcome of an orchestration call. Not-found and precondition failures come
 * back as a failure with a readable message instead of an exception.
 */
public record OperationResult<T>(boolean success, T value, String message) {

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(true, value, null);
    }

    public static <T> OperationResult<T> failure(String message) {
        return new OperationResult<>(false, null, Objects.requireNonNull(message, "message"));
    }
}
