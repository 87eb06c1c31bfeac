package com.investbyyourself.etl.service.collector;

import com.investbyyourself.etl.config.EtlProperties;
import com.investbyyourself.etl.model.CollectionMetrics;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.RawRecord;
import com.investbyyourself.etl.service.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs collectors concurrently under a concurrency cap shared by every run of this
 * orchestrator. A failing, slow or crashing collector is reported in the result without
 * affecting the others. A collector that exceeds its time limit has its token cancelled
 * and keeps its permit until it actually returns.
 */
@Service
public class CollectionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(CollectionOrchestrator.class);

    private static final Comparator<SourceCollector> DISPATCH_ORDER =
            Comparator.comparingInt(SourceCollector::priority).thenComparing(SourceCollector::name);

    private final Executor executor;
    private final int concurrency;
    private final Duration collectorTimeout;
    private final Duration cancellationGrace;
    private final Semaphore permits;

    @Autowired
    public CollectionOrchestrator(@Qualifier("collectorExecutor") Executor executor, EtlProperties properties) {
        this(executor,
                properties.getOrchestrator().getConcurrency(),
                properties.getOrchestrator().getCollectorTimeout(),
                properties.getOrchestrator().getCancellationGrace());
    }

    public CollectionOrchestrator(Executor executor, int concurrency, Duration collectorTimeout, Duration cancellationGrace) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1 but was " + concurrency);
        }
        this.executor = executor;
        this.concurrency = concurrency;
        this.collectorTimeout = collectorTimeout;
        this.cancellationGrace = cancellationGrace;
        this.permits = new Semaphore(concurrency);
    }

    public OrchestratorResult run(List<SourceCollector> collectors, CollectionRequest request, CancellationToken token) {
        List<SourceCollector> ordered = new ArrayList<>(collectors);
        ordered.sort(DISPATCH_ORDER);
        Map<SourceCollector, CompletableFuture<CollectionResult>> inFlight = new LinkedHashMap<>();

        logger.info("Dispatching {} collectors for {} keys (concurrency={})",
                ordered.size(), request.entityKeys().size(), concurrency);

        for (SourceCollector collector : ordered) {
            if (!acquire(token)) {
                break;
            }
            inFlight.put(collector, dispatch(collector, request, token));
        }

        awaitCompletion(inFlight, token);

        List<CollectionResult> results = new ArrayList<>();
        List<RawRecord> records = new ArrayList<>();
        CollectionMetrics totals = CollectionMetrics.empty();
        for (SourceCollector collector : ordered) {
            CollectionResult result = resultOf(collector, inFlight.get(collector));
            results.add(result);
            records.addAll(result.records());
            totals = totals.plus(result.metrics());
            if (result.collectorFailed()) {
                logger.error("collector={} failed kind={}: {}", collector.name(), result.error(), result.errorMessage());
            }
        }
        records.sort(mergeOrder(results));
        logger.info("Collection finished: records={} failedCollectors={} cancelled={} throughput={} records/s",
                records.size(), results.stream().filter(CollectionResult::collectorFailed).count(), token.isCancelled(),
                String.format("%.1f", totals.throughputPerSecond()));
        return new OrchestratorResult(records, results, totals, token.isCancelled());
    }

    /**
     * Provider priority, then provider name, then entity key, then capture time. The sort is
     * stable so records that tie keep the collector's emission order.
     */
    private static Comparator<RawRecord> mergeOrder(List<CollectionResult> results) {
        Map<String, Integer> priorities = new LinkedHashMap<>();
        for (CollectionResult result : results) {
            priorities.put(result.collectorName(), result.priority());
        }
        return Comparator.<RawRecord>comparingInt(r -> priorities.getOrDefault(r.provider(), Integer.MAX_VALUE))
                .thenComparing(RawRecord::provider)
                .thenComparing(r -> r.entityKey() == null ? "" : r.entityKey())
                .thenComparing(RawRecord::capturedAt);
    }

    private CompletableFuture<CollectionResult> dispatch(SourceCollector collector,
                                                         CollectionRequest request,
                                                         CancellationToken token) {
        CancellationToken collectorToken = token.child();
        CompletableFuture<CollectionResult> work;
        try {
            work = CompletableFuture.supplyAsync(() -> {
                try {
                    return collector.collect(request, collectorToken);
                } finally {
                    permits.release();
                }
            }, executor);
        } catch (RuntimeException rejected) {
            permits.release();
            return CompletableFuture.failedFuture(rejected);
        }
        CompletableFuture<CollectionResult> view = work.copy()
                .orTimeout(collectorTimeout.toMillis(), TimeUnit.MILLISECONDS);
        view.whenComplete((r, e) -> {
            if (e instanceof TimeoutException) {
                logger.warn("collector={} exceeded {} ms, cancelling it", collector.name(), collectorTimeout.toMillis());
            }
            if (e != null) {
                collectorToken.cancel();
            }
        });
        return view;
    }

    private boolean acquire(CancellationToken token) {
        try {
            while (!token.isCancelled()) {
                if (permits.tryAcquire(100, TimeUnit.MILLISECONDS)) {
                    if (!token.isCancelled()) {
                        return true;
                    }
                    permits.release();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
        }
        return false;
    }

    private void awaitCompletion(Map<SourceCollector, CompletableFuture<CollectionResult>> inFlight,
                                 CancellationToken token) {
        if (inFlight.isEmpty()) {
            return;
        }
        CompletableFuture<Void> all = CompletableFuture.allOf(inFlight.values().toArray(new CompletableFuture[0]));
        CompletableFuture<Void> cancelled = new CompletableFuture<>();
        token.onCancel(() -> cancelled.complete(null));
        try {
            CompletableFuture.anyOf(all, cancelled).join();
            if (!all.isDone()) {
                logger.warn("Run cancelled, waiting {} ms for in-flight collectors", cancellationGrace.toMillis());
                all.get(cancellationGrace.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            logger.warn("Abandoning collectors still running after cancellation grace");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
        } catch (ExecutionException | CompletionException e) {
            logger.debug("At least one collector completed exceptionally: {}", e.getMessage());
        }
    }

    private CollectionResult resultOf(SourceCollector collector, CompletableFuture<CollectionResult> future) {
        if (future == null) {
            return CollectionResult.failed(collector.name(), collector.priority(), ErrorKind.CANCELLED,
                    "not dispatched before cancellation");
        }
        if (!future.isDone()) {
            future.cancel(false);
            return CollectionResult.failed(collector.name(), collector.priority(), ErrorKind.CANCELLED,
                    "abandoned after cancellation grace");
        }
        try {
            return future.join();
        } catch (CancellationException e) {
            return CollectionResult.failed(collector.name(), collector.priority(), ErrorKind.CANCELLED,
                    "collector cancelled");
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                return CollectionResult.failed(collector.name(), collector.priority(), ErrorKind.TRANSIENT_PROVIDER,
                        "collector exceeded time limit of " + collectorTimeout);
            }
            return CollectionResult.failed(collector.name(), collector.priority(), ErrorKind.TRANSIENT_PROVIDER,
                    "collector crashed: " + cause);
        }
    }
}
