package com.investbyyourself.etl.model;

public enum FieldType {
    DECIMAL,
    TEXT,
    DATE
}
