package com.investbyyourself.etl.model;

import java.time.Duration;

/**
 * Per-collector counters for one collection call. Read-only once created.
 */
public record CollectionMetrics(int attempted,
                                int succeeded,
                                int failed,
                                int skipped,
                                int recordsCollected,
                                int apiCalls,
                                int retries,
                                int rateLimitWaits,
                                Duration duration) {

    public static CollectionMetrics empty() {
        return new CollectionMetrics(0, 0, 0, 0, 0, 0, 0, 0, Duration.ZERO);
    }

    public double throughputPerSecond() {
        double seconds = duration.toMillis() / 1000.0;
        return seconds > 0 ? recordsCollected / seconds : 0.0;
    }

    public CollectionMetrics plus(CollectionMetrics other) {
        return new CollectionMetrics(
                attempted + other.attempted,
                succeeded + other.succeeded,
                failed + other.failed,
                skipped + other.skipped,
                recordsCollected + other.recordsCollected,
                apiCalls + other.apiCalls,
                retries + other.retries,
                rateLimitWaits + other.rateLimitWaits,
                duration.compareTo(other.duration) >= 0 ? duration : other.duration);
    }
}
