package com.investbyyourself.etl.model;

import java.time.Duration;

/**
 * Counters for one load against one backend.
 */
public record LoadingMetrics(int processed,
                             int inserted,
                             int updated,
                             int deleted,
                             int skipped,
                             int failed,
                             Duration duration) {

    public static LoadingMetrics empty() {
        return new LoadingMetrics(0, 0, 0, 0, 0, 0, Duration.ZERO);
    }

    public int succeeded() {
        return inserted + updated;
    }

    public int writes() {
        return inserted + updated + deleted;
    }

    public double throughputPerSecond() {
        double seconds = duration.toMillis() / 1000.0;
        return seconds > 0 ? processed / seconds : 0.0;
    }

    public LoadingMetrics plus(LoadingMetrics other) {
        return new LoadingMetrics(
                processed + other.processed,
                inserted + other.inserted,
                updated + other.updated,
                deleted + other.deleted,
                skipped + other.skipped,
                failed + other.failed,
                duration.plus(other.duration));
    }

    public LoadingMetrics withDuration(Duration total) {
        return new LoadingMetrics(processed, inserted, updated, deleted, skipped, failed, total);
    }
}
