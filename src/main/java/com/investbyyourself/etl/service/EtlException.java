package com.investbyyourself.etl.service;

import com.investbyyourself.etl.model.ErrorKind;

/**
 * Base exception carrying the error classification used in run reports.
 */
public class EtlException extends RuntimeException {

    private final ErrorKind kind;

    public EtlException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EtlException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
