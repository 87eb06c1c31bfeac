package com.investbyyourself.etl.service;

import com.investbyyourself.etl.model.ErrorKind;

public class ConfigurationException extends EtlException {
    public ConfigurationException(String m) { super(ErrorKind.CONFIGURATION, m); }
    public ConfigurationException(String m, Throwable c) { super(ErrorKind.CONFIGURATION, m, c); }
}
