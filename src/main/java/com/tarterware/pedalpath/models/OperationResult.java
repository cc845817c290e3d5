package com.tarterware.pedalpath.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of an engine operation. Rejected input is reported here rather
 * than thrown, so callers branch on {@link #isSuccess()}.
 *
 * @param <T> type of the value carried on success.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationResult<T>
{
    boolean success;

    T value;

    FailureReason failure;

    String message;

    public static <T> OperationResult<T> ok(T value)
    {
        return new OperationResult<>(true, value, null, null);
    }

    public static <T> OperationResult<T> failure(FailureReason failure, String message)
    {
        return new OperationResult<>(false, null, failure, message);
    }
}
