package com.investbyyourself.etl.service;

import com.investbyyourself.etl.config.EtlProperties;
import com.investbyyourself.etl.dto.BackendSummary;
import com.investbyyourself.etl.dto.RunPipelineRequest;
import com.investbyyourself.etl.dto.RunResult;
import com.investbyyourself.etl.dto.StageSummary;
import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.CollectionMetrics;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.ErrorSample;
import com.investbyyourself.etl.model.LoadingMetrics;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.RunStatus;
import com.investbyyourself.etl.model.TimeWindow;
import com.investbyyourself.etl.service.collector.CollectionOrchestrator;
import com.investbyyourself.etl.service.collector.CollectionRequest;
import com.investbyyourself.etl.service.collector.CollectionResult;
import com.investbyyourself.etl.service.collector.CollectorRegistry;
import com.investbyyourself.etl.service.collector.KeyFailure;
import com.investbyyourself.etl.service.collector.OrchestratorResult;
import com.investbyyourself.etl.service.collector.SourceCollector;
import com.investbyyourself.etl.service.loader.LoadResult;
import com.investbyyourself.etl.service.loader.LoadTarget;
import com.investbyyourself.etl.service.loader.LoaderService;
import com.investbyyourself.etl.service.loader.StorageBackend;
import com.investbyyourself.etl.service.transform.RuleSet;
import com.investbyyourself.etl.service.transform.TransformResult;
import com.investbyyourself.etl.service.transform.TransformationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Runs collection, transformation and loading for one request and reports the outcome.
 * Record-, collector- and backend-scoped failures end up in the report; only
 * configuration problems fail the run as a whole.
 */
@Service
public class PipelineCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineCoordinator.class);

    private final CollectorRegistry collectorRegistry;
    private final CollectionOrchestrator orchestrator;
    private final TransformationEngine transformationEngine;
    private final RuleSet ruleSet;
    private final LoaderService loaderService;
    private final PipelineRunService runService;
    private final EtlProperties properties;
    private final Clock clock;

    public PipelineCoordinator(CollectorRegistry collectorRegistry,
                               CollectionOrchestrator orchestrator,
                               TransformationEngine transformationEngine,
                               RuleSet ruleSet,
                               LoaderService loaderService,
                               PipelineRunService runService,
                               EtlProperties properties,
                               Clock clock) {
        this.collectorRegistry = collectorRegistry;
        this.orchestrator = orchestrator;
        this.transformationEngine = transformationEngine;
        this.ruleSet = ruleSet;
        this.loaderService = loaderService;
        this.runService = runService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Synchronous run. Request problems (unknown provider, empty key list, inverted time
     * window, run id already in use) are rejected with {@link ConfigurationException} or
     * {@link IllegalArgumentException} before a run is registered.
     */
    public RunResult runPipeline(RunPipelineRequest request) {
        if (request.getProviders() == null || request.getProviders().isEmpty()) {
            throw new IllegalArgumentException("providers must not be empty");
        }
        if (request.getEntityKeys() == null || request.getEntityKeys().isEmpty()) {
            throw new IllegalArgumentException("entityKeys must not be empty");
        }
        List<SourceCollector> collectors = collectorRegistry.resolve(request.getProviders());
        CollectionRequest collectionRequest = new CollectionRequest(request.getEntityKeys(),
                new TimeWindow(request.getFrom(), request.getTo()), Map.of());

        LoadingStrategy strategy = request.getStrategy() != null
                ? request.getStrategy()
                : properties.getLoader().getDefaultStrategy();
        Set<BackendKind> backends = request.getBackends() != null && !request.getBackends().isEmpty()
                ? EnumSet.copyOf(request.getBackends())
                : EnumSet.copyOf(properties.getLoader().getDefaultBackends());
        String dataset = request.getDataset() != null && !request.getDataset().isBlank()
                ? request.getDataset()
                : properties.getRun().getDefaultDataset();
        LoadTarget target = new LoadTarget(dataset, backends,
                request.getScopeGranularity() != null
                        ? request.getScopeGranularity()
                        : properties.getLoader().getScopeGranularity(),
                request.isDropLowQuality());

        UUID runId = request.getRunId() != null ? request.getRunId() : UUID.randomUUID();
        Instant startedAt = clock.instant();
        CancellationToken token = runService.start(RunResult.running(runId, dataset, strategy, startedAt));
        RunReport report = new RunReport(runId, dataset, strategy, startedAt, properties.getRun().getErrorSampleLimit());

        try {
            List<ErrorSample> backendProblems = validateBackends(backends);
            if (!backendProblems.isEmpty()) {
                backendProblems.forEach(report::error);
                return finish(report.finish(RunStatus.FAILED, clock.instant()));
            }

            OrchestratorResult collected = orchestrator.run(collectors, collectionRequest, token);
            report.collected(collected);
            runService.progress(report.finish(RunStatus.RUNNING, null));
            if (token.isCancelled()) {
                return finish(report.finish(RunStatus.CANCELLED, clock.instant()));
            }

            TransformResult transformed = transformationEngine.transform(collected.records(), ruleSet);
            report.transformed(transformed);
            runService.progress(report.finish(RunStatus.RUNNING, null));
            if (token.isCancelled()) {
                return finish(report.finish(RunStatus.CANCELLED, clock.instant()));
            }

            LoadResult loaded = loaderService.load(transformed.records(), target, strategy, token);
            report.loaded(loaded);
            if (token.isCancelled()) {
                return finish(report.finish(RunStatus.CANCELLED, clock.instant()));
            }
            return finish(report.finish(report.outcome(), clock.instant()));
        } catch (ConfigurationException e) {
            logger.error("runId={} configuration error: {}", runId, e.getMessage());
            report.error(new ErrorSample("run", runId.toString(), ErrorKind.CONFIGURATION, e.getMessage()));
            return finish(report.finish(RunStatus.FAILED, clock.instant()));
        } catch (RuntimeException e) {
            logger.error("runId={} aborted", runId, e);
            report.error(new ErrorSample("run", runId.toString(), ErrorKind.LOAD_FAILED, e.toString()));
            finish(report.finish(RunStatus.FAILED, clock.instant()));
            throw e;
        }
    }

    private RunResult finish(RunResult result) {
        runService.complete(result);
        return result;
    }

    private List<ErrorSample> validateBackends(Set<BackendKind> requested) {
        Map<BackendKind, StorageBackend> configured = loaderService.backends();
        List<ErrorSample> problems = new ArrayList<>();
        for (BackendKind kind : requested) {
            StorageBackend backend = configured.get(kind);
            if (backend == null) {
                problems.add(new ErrorSample("validate", kind.name(), ErrorKind.CONFIGURATION,
                        "backend " + kind + " is not configured"));
                continue;
            }
            try {
                backend.validate();
            } catch (EtlException e) {
                logger.error("backend={} failed validation: {}", kind, e.getMessage());
                problems.add(new ErrorSample("validate", kind.name(), ErrorKind.CONFIGURATION, e.getMessage()));
            }
        }
        return problems;
    }

    /**
     * Accumulates stage results into a {@link RunResult}.
     */
    static final class RunReport {
        private final UUID runId;
        private final String dataset;
        private final LoadingStrategy strategy;
        private final Instant startedAt;
        private final int sampleLimit;
        private final List<ErrorSample> errors = new ArrayList<>();
        private int errorCount;
        private StageSummary collection;
        private StageSummary transform;
        private StageSummary load;
        private List<BackendSummary> backends = List.of();
        private LoadResult loadResult;
        private int lowQuality;
        private BigDecimal averageQuality;

        RunReport(UUID runId, String dataset, LoadingStrategy strategy, Instant startedAt, int sampleLimit) {
            this.runId = runId;
            this.dataset = dataset;
            this.strategy = strategy;
            this.startedAt = startedAt;
            this.sampleLimit = sampleLimit;
        }

        void error(ErrorSample sample) {
            errorCount++;
            if (errors.size() < sampleLimit) {
                errors.add(sample);
            }
        }

        void collected(OrchestratorResult result) {
            CollectionMetrics totals = result.totals();
            int failedCollectorKeys = 0;
            for (CollectionResult collector : result.collectorResults()) {
                if (collector.collectorFailed()) {
                    error(new ErrorSample("collect", collector.collectorName(), collector.error(),
                            collector.errorMessage()));
                    failedCollectorKeys++;
                }
                for (KeyFailure failure : collector.failures()) {
                    error(new ErrorSample("collect", collector.collectorName() + ":" + failure.entityKey(),
                            failure.kind(), failure.message()));
                }
            }
            collection = new StageSummary(totals.attempted(), totals.succeeded(),
                    totals.failed() + failedCollectorKeys, totals.skipped(), totals.duration().toMillis());
        }

        void transformed(TransformResult result) {
            result.qualityReport().invalidRecords().forEach(this::error);
            transform = new StageSummary(result.metrics().inputRecords(), result.metrics().outputRecords(),
                    result.metrics().invalidRecords(), 0, result.metrics().duration().toMillis());
            lowQuality = result.metrics().lowQualityRecords();
            averageQuality = result.qualityReport().averageScore();
        }

        void loaded(LoadResult result) {
            loadResult = result;
            result.errors().forEach(this::error);
            LoadingMetrics metrics = result.metrics();
            load = new StageSummary(metrics.processed(), metrics.succeeded(), metrics.failed(),
                    metrics.skipped() + result.heldBack(), longest(result));
            backends = result.backends().stream().map(BackendSummary::of).toList();
        }

        private static long longest(LoadResult result) {
            return result.backends().stream()
                    .map(b -> b.metrics().duration())
                    .max(Duration::compareTo)
                    .orElse(Duration.ZERO)
                    .toMillis();
        }

        /**
         * SUCCESS without failures, PARTIAL_SUCCESS when something failed but some records
         * were loaded or left unchanged by every backend that was asked, FAILED otherwise.
         */
        RunStatus outcome() {
            if (errorCount == 0) {
                return RunStatus.SUCCESS;
            }
            if (loadResult == null) {
                return RunStatus.FAILED;
            }
            LoadingMetrics metrics = loadResult.metrics();
            boolean anyPersisted = metrics.processed() - metrics.failed() > 0;
            return anyPersisted ? RunStatus.PARTIAL_SUCCESS : RunStatus.FAILED;
        }

        RunResult finish(RunStatus status, Instant finishedAt) {
            return new RunResult(runId, status, dataset, strategy, startedAt, finishedAt, collection, transform, load,
                    backends, loadResult == null ? List.of() : loadResult.versions(), lowQuality, averageQuality,
                    errorCount, errors);
        }
    }
}
