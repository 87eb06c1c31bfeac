package com.investbyyourself.etl.service.collector;

import com.investbyyourself.etl.service.CancellationToken;
import com.investbyyourself.etl.service.collector.ProviderRateLimiter.Permit;
import com.investbyyourself.etl.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderRateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-15T10:00:00Z"));

    @Test
    void deniesWhenPermitNotAvailableWithinMaxWait() {
        ProviderRateLimiter limiter = new ProviderRateLimiter("alphavantage", 1, 0, Duration.ZERO, clock);

        assertThat(limiter.acquire()).isEqualTo(Permit.IMMEDIATE);
        assertThat(limiter.acquire()).isEqualTo(Permit.DENIED_RATE);
        assertThat(limiter.usedToday()).isEqualTo(1);
    }

    @Test
    void waitsForPermitWithinMaxWait() {
        ProviderRateLimiter limiter = new ProviderRateLimiter("yahoo", 600, 0, Duration.ofSeconds(2), clock);

        assertThat(limiter.acquire()).isEqualTo(Permit.IMMEDIATE);
        assertThat(limiter.acquire().granted()).isTrue();
    }

    @Test
    void dailyQuotaResetsAtUtcMidnight() {
        ProviderRateLimiter limiter = new ProviderRateLimiter("fred", 60_000, 2, Duration.ofSeconds(1), clock);

        assertThat(limiter.acquire().granted()).isTrue();
        assertThat(limiter.acquire().granted()).isTrue();
        assertThat(limiter.acquire()).isEqualTo(Permit.DENIED_QUOTA);

        clock.set(Instant.parse("2024-03-16T00:00:01Z"));

        assertThat(limiter.usedToday()).isZero();
        assertThat(limiter.acquire().granted()).isTrue();
    }

    @Test
    void multiCallFetchReservesAllSlots() {
        ProviderRateLimiter limiter = new ProviderRateLimiter("alphavantage", 60_000, 5, Duration.ofSeconds(1), clock);

        assertThat(limiter.acquire(3).granted()).isTrue();
        assertThat(limiter.acquire(3)).isEqualTo(Permit.DENIED_QUOTA);
        assertThat(limiter.usedToday()).isEqualTo(3);
    }

    @Test
    void rejectsNonPositiveRate() {
        assertThatThrownBy(() -> new ProviderRateLimiter("x", 0, 0, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancelledRunStopsWaitingAndGivesBackDailySlot() {
        ProviderRateLimiter limiter = new ProviderRateLimiter("alphavantage", 1, 25, Duration.ofSeconds(60), clock);
        CancellationToken token = new CancellationToken();
        assertThat(limiter.acquire(1, token)).isEqualTo(Permit.IMMEDIATE);

        CompletableFuture.runAsync(token::cancel, CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS));
        long started = System.nanoTime();
        Permit permit = limiter.acquire(1, token);

        assertThat(permit).isEqualTo(Permit.CANCELLED);
        assertThat(permit.granted()).isFalse();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        assertThat(limiter.usedToday()).isEqualTo(1);
    }
}
