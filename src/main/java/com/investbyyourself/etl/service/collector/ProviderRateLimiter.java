package com.investbyyourself.etl.service.collector;

import com.google.common.util.concurrent.RateLimiter;
import com.investbyyourself.etl.service.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;

/**
 * Per-provider call budget: a Guava token bucket for the per-minute rate plus a fixed
 * UTC-day window for the daily quota. Callers over budget wait up to {@code maxWait},
 * in short slices so a cancelled run stops waiting; a permit that cannot be granted
 * within that wait is denied.
 */
@SuppressWarnings("UnstableApiUsage")
public class ProviderRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(ProviderRateLimiter.class);

    private static final long WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(250);

    public enum Permit {
        IMMEDIATE,
        AFTER_WAIT,
        DENIED_RATE,
        DENIED_QUOTA,
        CANCELLED;

        public boolean granted() {
            return this == IMMEDIATE || this == AFTER_WAIT;
        }
    }

    private final String provider;
    private final RateLimiter limiter;
    private final int callsPerDay;
    private final Duration maxWait;
    private final Clock clock;

    private LocalDate quotaDay;
    private int usedToday;

    public ProviderRateLimiter(String provider, int callsPerMinute, int callsPerDay, Duration maxWait, Clock clock) {
        if (callsPerMinute <= 0) {
            throw new IllegalArgumentException("callsPerMinute must be positive for " + provider);
        }
        this.provider = provider;
        this.limiter = RateLimiter.create(callsPerMinute / 60.0);
        this.callsPerDay = Math.max(0, callsPerDay);
        this.maxWait = maxWait;
        this.clock = clock;
        this.quotaDay = LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    public Permit acquire() {
        return acquire(1);
    }

    public Permit acquire(int calls) {
        return acquire(calls, CancellationToken.none());
    }

    /**
     * Blocks until {@code calls} calls may be issued, the maximum wait is exceeded or the
     * token is cancelled. Daily slots are given back unless a permit is granted.
     */
    public Permit acquire(int calls, CancellationToken token) {
        if (!reserveDailySlots(calls)) {
            logger.warn("provider={} daily quota of {} calls exhausted", provider, callsPerDay);
            return Permit.DENIED_QUOTA;
        }
        if (limiter.tryAcquire(calls)) {
            return Permit.IMMEDIATE;
        }
        logger.debug("provider={} over rate budget, waiting up to {} ms", provider, maxWait.toMillis());
        long deadline = System.nanoTime() + maxWait.toNanos();
        try {
            while (!token.isCancelled()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    releaseDailySlots(calls);
                    logger.warn("provider={} permit not available within {} ms", provider, maxWait.toMillis());
                    return Permit.DENIED_RATE;
                }
                long slice = Math.min(remaining, WAIT_SLICE_NANOS);
                // Guava returns false at once when no permit frees up within the slice
                if (limiter.tryAcquire(calls, slice, TimeUnit.NANOSECONDS)) {
                    return Permit.AFTER_WAIT;
                }
                TimeUnit.NANOSECONDS.sleep(slice);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        releaseDailySlots(calls);
        logger.info("provider={} stopped waiting for a permit, run cancelled", provider);
        return Permit.CANCELLED;
    }

    public synchronized int usedToday() {
        rollWindow();
        return usedToday;
    }

    private synchronized boolean reserveDailySlots(int calls) {
        rollWindow();
        if (callsPerDay > 0 && usedToday + calls > callsPerDay) {
            return false;
        }
        usedToday += calls;
        return true;
    }

    private synchronized void releaseDailySlots(int calls) {
        usedToday = Math.max(0, usedToday - calls);
    }

    private void rollWindow() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        if (!today.equals(quotaDay)) {
            quotaDay = today;
            usedToday = 0;
        }
    }
}
