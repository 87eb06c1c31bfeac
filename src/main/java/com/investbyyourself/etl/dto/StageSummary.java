package com.investbyyourself.etl.dto;

public record StageSummary(int attempted, int succeeded, int failed, int skipped, long durationMs) {

    public static StageSummary empty() {
        return new StageSummary(0, 0, 0, 0, 0L);
    }
}
