package com.investbyyourself.etl.service.retry;

import com.investbyyourself.etl.model.ErrorKind;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a fallible call: either a value or a classified failure.
 */
public final class Result<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String message;
    private final int attempts;

    private Result(T value, ErrorKind errorKind, String message, int attempts) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
        this.attempts = attempts;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null, null, 1);
    }

    public static <T> Result<T> failure(ErrorKind kind, String message) {
        return new Result<>(null, Objects.requireNonNull(kind, "kind"), message, 1);
    }

    public boolean isOk() {
        return errorKind == null;
    }

    public T value() {
        if (!isOk()) {
            throw new IllegalStateException("No value on failed result: " + errorKind + " " + message);
        }
        return value;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    public String message() {
        return message;
    }

    public int attempts() {
        return attempts;
    }

    public boolean isRetryable() {
        return errorKind != null && errorKind.isRetryable();
    }

    Result<T> withAttempts(int count) {
        return new Result<>(value, errorKind, message, count);
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (!isOk()) {
            return new Result<>(null, errorKind, message, attempts);
        }
        return new Result<>(mapper.apply(value), null, null, attempts);
    }

    @Override
    public String toString() {
        return isOk() ? "Result[ok, attempts=" + attempts + "]"
                : "Result[" + errorKind + ", " + message + ", attempts=" + attempts + "]";
    }
}
