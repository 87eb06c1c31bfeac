package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.config.EtlProperties;
import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.DataVersion;
import com.investbyyourself.etl.model.DataVersionAudit;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.ErrorSample;
import com.investbyyourself.etl.model.LoadingMetrics;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.TransformedRecord;
import com.investbyyourself.etl.repository.DataVersionAuditRepository;
import com.investbyyourself.etl.service.CancellationToken;
import com.investbyyourself.etl.service.EtlException;
import com.investbyyourself.etl.service.retry.Result;
import com.investbyyourself.etl.service.retry.RetryExecutor;
import com.investbyyourself.etl.service.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Loads transformed records into the requested backends. Backends run in parallel and
 * independently: a backend that stays unreachable after its retries is reported failed
 * while the others carry on. Within a backend each scope is loaded atomically; a version
 * conflict fails only that scope.
 */
@Service
public class LoaderService {

    private static final Logger logger = LoggerFactory.getLogger(LoaderService.class);

    private final Map<BackendKind, StorageBackend> backends = new EnumMap<>(BackendKind.class);
    private final Executor executor;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final DataVersionAuditRepository auditRepository;

    @Autowired
    public LoaderService(List<StorageBackend> storageBackends,
                         @Qualifier("loaderExecutor") Executor executor,
                         RetryExecutor retryExecutor,
                         EtlProperties properties,
                         DataVersionAuditRepository auditRepository) {
        this(storageBackends, executor, retryExecutor,
                new RetryPolicy(properties.getLoader().getMaxAttempts(),
                        properties.getLoader().getBackoffBase(),
                        properties.getLoader().getBackoffMax()),
                auditRepository);
    }

    public LoaderService(List<StorageBackend> storageBackends,
                         Executor executor,
                         RetryExecutor retryExecutor,
                         RetryPolicy retryPolicy,
                         DataVersionAuditRepository auditRepository) {
        for (StorageBackend backend : storageBackends) {
            backends.put(backend.kind(), backend);
        }
        this.executor = executor;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
        this.auditRepository = auditRepository;
    }

    public LoadResult load(List<TransformedRecord> records,
                           LoadTarget target,
                           LoadingStrategy strategy,
                           CancellationToken token) {
        List<TransformedRecord> accepted = records;
        int heldBack = 0;
        if (target.dropLowQuality()) {
            accepted = records.stream().filter(r -> !r.lowQuality()).toList();
            heldBack = records.size() - accepted.size();
        }

        Map<String, List<TransformedRecord>> scopes = new TreeMap<>();
        for (TransformedRecord record : accepted) {
            scopes.computeIfAbsent(target.scopeKey(record), k -> new ArrayList<>()).add(record);
        }
        logger.info("Loading dataset={} strategy={} records={} scopes={} backends={} heldBack={}",
                target.dataset(), strategy, accepted.size(), scopes.size(), target.backends(), heldBack);

        Map<BackendKind, CompletableFuture<BackendLoadResult>> futures = new EnumMap<>(BackendKind.class);
        for (BackendKind kind : target.backends()) {
            StorageBackend backend = backends.get(kind);
            if (backend == null) {
                futures.put(kind, CompletableFuture.completedFuture(unconfigured(kind, accepted.size())));
                continue;
            }
            futures.put(kind, CompletableFuture.supplyAsync(
                    () -> loadBackend(backend, target.dataset(), scopes, strategy, token), executor));
        }

        List<BackendLoadResult> results = new ArrayList<>();
        for (Map.Entry<BackendKind, CompletableFuture<BackendLoadResult>> entry : futures.entrySet()) {
            try {
                results.add(entry.getValue().join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.error("backend={} load crashed", entry.getKey(), cause);
                results.add(new BackendLoadResult(entry.getKey(),
                        new LoadingMetrics(accepted.size(), 0, 0, 0, 0, accepted.size(), Duration.ZERO),
                        List.of(), new ArrayList<>(scopes.keySet()),
                        List.of(new ErrorSample("load", entry.getKey().name(), ErrorKind.LOAD_FAILED,
                                String.valueOf(cause.getMessage()))),
                        ErrorKind.LOAD_FAILED));
            }
        }
        return new LoadResult(results, heldBack);
    }

    public Map<BackendKind, StorageBackend> backends() {
        return backends;
    }

    private BackendLoadResult loadBackend(StorageBackend backend,
                                          String dataset,
                                          Map<String, List<TransformedRecord>> scopes,
                                          LoadingStrategy strategy,
                                          CancellationToken token) {
        long started = System.nanoTime();
        BackendKind kind = backend.kind();
        LoadingMetrics metrics = LoadingMetrics.empty();
        List<DataVersion> versions = new ArrayList<>();
        List<String> failedScopes = new ArrayList<>();
        List<ErrorSample> errors = new ArrayList<>();
        ErrorKind backendFailure = null;

        for (Map.Entry<String, List<TransformedRecord>> scope : scopes.entrySet()) {
            String scopeKey = scope.getKey();
            List<TransformedRecord> scopeRecords = scope.getValue();
            if (backendFailure != null || token.isCancelled()) {
                metrics = metrics.plus(notLoaded(scopeRecords.size(), backendFailure != null));
                failedScopes.add(scopeKey);
                continue;
            }
            Result<ScopeLoadOutcome> result = retryExecutor.execute(
                    "load:" + kind + ":" + scopeKey, retryPolicy, token,
                    () -> attempt(backend, dataset, scopeKey, scopeRecords, strategy, token));
            if (result.isOk()) {
                ScopeLoadOutcome outcome = result.value();
                metrics = metrics.plus(outcome.metrics());
                errors.addAll(outcome.recordFailures());
                if (outcome.versionCreated()) {
                    versions.add(outcome.version());
                    audit(outcome.version());
                }
                continue;
            }

            failedScopes.add(scopeKey);
            errors.add(new ErrorSample("load", kind + ":" + scopeKey, result.errorKind(), result.message()));
            if (result.errorKind() == ErrorKind.CANCELLED) {
                metrics = metrics.plus(notLoaded(scopeRecords.size(), false));
            } else {
                metrics = metrics.plus(notLoaded(scopeRecords.size(), true));
            }
            if (result.errorKind() == ErrorKind.BACKEND_UNAVAILABLE) {
                logger.error("backend={} unavailable after {} attempts, abandoning remaining scopes: {}",
                        kind, result.attempts(), result.message());
                backendFailure = ErrorKind.LOAD_FAILED;
            } else {
                logger.warn("backend={} scope={} failed kind={}: {}", kind, scopeKey, result.errorKind(), result.message());
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        metrics = metrics.withDuration(elapsed);
        logger.info("backend={} dataset={} inserted={} updated={} deleted={} skipped={} failed={} newVersions={} "
                        + "in {} ms ({} records/s)",
                kind, dataset, metrics.inserted(), metrics.updated(), metrics.deleted(), metrics.skipped(),
                metrics.failed(), versions.size(), elapsed.toMillis(), String.format("%.1f", metrics.throughputPerSecond()));
        return new BackendLoadResult(kind, metrics, versions, failedScopes, errors, backendFailure);
    }

    private Result<ScopeLoadOutcome> attempt(StorageBackend backend,
                                             String dataset,
                                             String scopeKey,
                                             List<TransformedRecord> records,
                                             LoadingStrategy strategy,
                                             CancellationToken token) {
        try {
            return Result.ok(backend.loadScope(dataset, scopeKey, records, strategy, token));
        } catch (EtlException e) {
            return Result.failure(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("backend={} scope={} unexpected failure", backend.kind(), scopeKey, e);
            return Result.failure(ErrorKind.LOAD_FAILED, e.toString());
        }
    }

    /**
     * The relational backend writes its audit row inside the load transaction.
     */
    private void audit(DataVersion version) {
        if (version.backend() == BackendKind.RELATIONAL || auditRepository == null) {
            return;
        }
        try {
            auditRepository.save(DataVersionAudit.of(version));
        } catch (DataAccessException e) {
            logger.warn("Could not record version audit for backend={} scope={} version={}: {}",
                    version.backend(), version.scopeKey(), version.versionId(), e.getMessage());
        }
    }

    private static LoadingMetrics notLoaded(int records, boolean failed) {
        return failed
                ? new LoadingMetrics(records, 0, 0, 0, 0, records, Duration.ZERO)
                : new LoadingMetrics(records, 0, 0, 0, records, 0, Duration.ZERO);
    }

    private BackendLoadResult unconfigured(BackendKind kind, int records) {
        logger.error("backend={} requested but not configured", kind);
        return new BackendLoadResult(kind, notLoaded(records, true), List.of(), List.of(),
                List.of(new ErrorSample("load", kind.name(), ErrorKind.CONFIGURATION, "backend not configured")),
                ErrorKind.CONFIGURATION);
    }
}
