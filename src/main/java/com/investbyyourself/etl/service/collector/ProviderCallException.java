package com.investbyyourself.etl.service.collector;

import com.investbyyourself.etl.model.ErrorKind;

/**
 * Classified failure of a single provider call.
 */
public class ProviderCallException extends Exception {

    private final ErrorKind kind;
    private final int status;

    public ProviderCallException(ErrorKind kind, int status, String message) {
        super(message);
        this.kind = kind;
        this.status = status;
    }

    public ProviderCallException(ErrorKind kind, int status, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * HTTP status, or 0 when no response was received.
     */
    public int getStatus() {
        return status;
    }
}
