package com.investbyyourself.etl.service.collector;

import com.investbyyourself.etl.model.CollectionMetrics;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.Provenance;
import com.investbyyourself.etl.model.RawRecord;
import com.investbyyourself.etl.service.CancellationToken;
import com.investbyyourself.etl.service.retry.Result;
import com.investbyyourself.etl.service.retry.RetryExecutor;
import com.investbyyourself.etl.service.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collector for one provider: every call goes through the provider's rate limiter,
 * transient failures are retried with backoff, and one failing key never stops the
 * other keys.
 */
public class RateLimitedCollector implements SourceCollector {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitedCollector.class);

    private final String name;
    private final int priority;
    private final ProviderClient client;
    private final ProviderRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final RetryExecutor retryExecutor;
    private final Clock clock;

    public RateLimitedCollector(String name,
                                int priority,
                                ProviderClient client,
                                ProviderRateLimiter rateLimiter,
                                RetryPolicy retryPolicy,
                                RetryExecutor retryExecutor,
                                Clock clock) {
        this.name = name;
        this.priority = priority;
        this.client = client;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public CollectionResult collect(CollectionRequest request, CancellationToken token) {
        Instant started = clock.instant();
        String requestId = UUID.randomUUID().toString();
        Provenance provenance = new Provenance(name, requestId);
        List<RawRecord> records = new ArrayList<>();
        List<KeyFailure> failures = new ArrayList<>();
        AtomicInteger apiCalls = new AtomicInteger();
        AtomicInteger rateLimitWaits = new AtomicInteger();
        int succeeded = 0;
        int skipped = 0;
        int retries = 0;

        logger.info("collector={} requestId={} collecting {} keys", name, requestId, request.entityKeys().size());
        for (String entityKey : request.entityKeys()) {
            if (token.isCancelled()) {
                skipped++;
                continue;
            }
            Result<List<Map<String, Object>>> result = retryExecutor.execute(
                    name + ":" + entityKey,
                    retryPolicy,
                    token,
                    () -> attempt(entityKey, request, token, apiCalls, rateLimitWaits));
            retries += Math.max(0, result.attempts() - 1);

            if (result.isOk()) {
                for (Map<String, Object> payload : result.value()) {
                    records.add(new RawRecord(name, entityKey, clock.instant(), payload, provenance));
                }
                succeeded++;
            } else if (result.errorKind() == ErrorKind.CANCELLED) {
                skipped++;
            } else {
                logger.warn("collector={} key={} kind={} attempts={} failed: {}",
                        name, entityKey, result.errorKind(), result.attempts(), result.message());
                failures.add(new KeyFailure(entityKey, result.errorKind(), result.message(), result.attempts()));
            }
        }

        Duration elapsed = Duration.between(started, clock.instant());
        CollectionMetrics metrics = new CollectionMetrics(
                request.entityKeys().size(),
                succeeded,
                failures.size(),
                skipped,
                records.size(),
                apiCalls.get(),
                retries,
                rateLimitWaits.get(),
                elapsed);
        logger.info("collector={} requestId={} done: keysOk={} keysFailed={} keysSkipped={} records={} calls={} retries={}",
                name, requestId, succeeded, failures.size(), skipped, records.size(), apiCalls.get(), retries);
        return new CollectionResult(name, priority, records, metrics, failures, null, null);
    }

    private Result<List<Map<String, Object>>> attempt(String entityKey,
                                                      CollectionRequest request,
                                                      CancellationToken token,
                                                      AtomicInteger apiCalls,
                                                      AtomicInteger rateLimitWaits) {
        ProviderRateLimiter.Permit permit = rateLimiter.acquire(client.callsPerFetch(), token);
        if (permit == ProviderRateLimiter.Permit.CANCELLED) {
            return Result.failure(ErrorKind.CANCELLED, name + ": cancelled while waiting for a rate limit permit");
        }
        if (permit == ProviderRateLimiter.Permit.AFTER_WAIT) {
            rateLimitWaits.incrementAndGet();
        }
        if (!permit.granted()) {
            String reason = permit == ProviderRateLimiter.Permit.DENIED_QUOTA
                    ? "daily call quota exhausted"
                    : "rate limit permit not granted within max wait";
            return Result.failure(ErrorKind.RATE_LIMIT_EXCEEDED, name + ": " + reason);
        }
        apiCalls.addAndGet(client.callsPerFetch());
        try {
            return Result.ok(client.fetch(entityKey, request.window()));
        } catch (ProviderCallException e) {
            return Result.failure(e.getKind(), e.getMessage());
        }
    }
}
