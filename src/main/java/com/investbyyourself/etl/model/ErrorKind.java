package com.investbyyourself.etl.model;

/**
 * Classification of every failure the pipeline reports. Only kinds flagged
 * {@code retryable} are fed back into a retry loop. {@link #RATE_LIMIT_EXCEEDED}
 * is raised after the limiter has already waited its maximum, so it is final.
 */
public enum ErrorKind {
    TRANSIENT_PROVIDER(true),
    RATE_LIMIT_EXCEEDED(false),
    AUTH_OR_VALIDATION(false),
    TRANSFORM_VALIDATION(false),
    BACKEND_UNAVAILABLE(true),
    VERSION_CONFLICT(false),
    LOAD_FAILED(false),
    CONFIGURATION(false),
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
