package com.investbyyourself.etl.service;

import com.investbyyourself.etl.model.ErrorKind;

public class RunCancelledException extends EtlException {
    public RunCancelledException(String m) { super(ErrorKind.CANCELLED, m); }
}
