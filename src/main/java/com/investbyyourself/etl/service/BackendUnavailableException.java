package com.investbyyourself.etl.service;

import com.investbyyourself.etl.model.ErrorKind;

/**
 * Storage backend could not be reached or refused the write. Retryable.
 */
public class BackendUnavailableException extends EtlException {
    public BackendUnavailableException(String m) { super(ErrorKind.BACKEND_UNAVAILABLE, m); }
    public BackendUnavailableException(String m, Throwable c) { super(ErrorKind.BACKEND_UNAVAILABLE, m, c); }
}
