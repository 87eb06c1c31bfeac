package com.investbyyourself.etl.model;

public enum BackendKind {
    RELATIONAL,
    FILE_ARCHIVE,
    CACHE
}
