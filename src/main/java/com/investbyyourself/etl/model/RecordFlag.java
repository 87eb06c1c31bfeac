package com.investbyyourself.etl.model;

public enum RecordFlag {
    LOW_QUALITY
}
