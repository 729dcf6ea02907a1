package com.flagship.finance_ledger.common;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Uniform outcome of a ledger operation.
 *
 * A successful result carries a value; a failed result carries an {@link ErrorKind}
 * and a human-readable message, and may still carry a value (batch import returns
 * its summary either way).
 *
 * @param <T> type of the carried value
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationResult<T> {
    boolean success;
    T value;
    ErrorKind errorKind;
    String message;

    public static <T> OperationResult<T> ok(T value) {
        return new OperationResult<>(true, value, null, null);
    }

    public static <T> OperationResult<T> failure(ErrorKind kind, String message) {
        return new OperationResult<>(false, null, kind, message);
    }

    public static <T> OperationResult<T> failure(ErrorKind kind, String message, T value) {
        return new OperationResult<>(false, value, kind, message);
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Re-types a failure so it can be returned from an operation with a different value type.
     *
     * @throws IllegalStateException if this result is a success
     */
    public <U> OperationResult<U> propagate() {
        if (success) {
            throw new IllegalStateException("Cannot propagate a successful result as a failure");
        }
        return new OperationResult<>(false, null, errorKind, message);
    }
}
