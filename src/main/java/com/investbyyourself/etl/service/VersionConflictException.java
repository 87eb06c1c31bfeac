package com.investbyyourself.etl.service;

import com.investbyyourself.etl.model.ErrorKind;

/**
 * Another writer committed the same scope between read and commit.
 */
public class VersionConflictException extends EtlException {
    public VersionConflictException(String m) { super(ErrorKind.VERSION_CONFLICT, m); }
}
