package com.investbyyourself.etl.service.retry;

import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.service.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Runs a call until it succeeds, fails with a non-retryable kind, runs out of attempts
 * or the run is cancelled. Only {@link ErrorKind#isRetryable()} failures are retried.
 */
public class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final Sleeper sleeper;
    private final boolean jitter;

    public RetryExecutor() {
        this(Sleeper.THREAD, true);
    }

    public RetryExecutor(Sleeper sleeper, boolean jitter) {
        this.sleeper = sleeper;
        this.jitter = jitter;
    }

    public <T> Result<T> execute(String operation,
                                 RetryPolicy policy,
                                 CancellationToken token,
                                 Supplier<Result<T>> call) {
        Result<T> last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (token != null && token.isCancelled()) {
                return Result.<T>failure(ErrorKind.CANCELLED, operation + " cancelled").withAttempts(attempt - 1);
            }
            last = call.get().withAttempts(attempt);
            if (last.isOk() || !last.isRetryable()) {
                return last;
            }
            if (attempt == policy.maxAttempts()) {
                logger.warn("operation={} attempts={} kind={} giving up: {}",
                        operation, attempt, last.errorKind(), last.message());
                break;
            }
            Duration delay = backoff(policy, attempt);
            logger.warn("operation={} attempt={}/{} kind={} backoffMs={} error={}",
                    operation, attempt, policy.maxAttempts(), last.errorKind(), delay.toMillis(), last.message());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return Result.<T>failure(ErrorKind.CANCELLED, operation + " interrupted during backoff")
                        .withAttempts(attempt);
            }
        }
        return last;
    }

    Duration backoff(RetryPolicy policy, int attempt) {
        long base = policy.baseDelay().toMillis();
        long extra = jitter ? ThreadLocalRandom.current().nextLong(50, 200) : 0L;
        long millis = (long) Math.min(policy.maxDelay().toMillis(), base * Math.pow(2, attempt - 1) + extra);
        return Duration.ofMillis(Math.max(0L, millis));
    }
}
