package com.investbyyourself.etl.dto;

import com.investbyyourself.etl.model.DataVersion;
import com.investbyyourself.etl.model.ErrorSample;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.RunStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Report of one pipeline run: per-stage counts, per-backend results, new versions and
 * the first error samples. {@code errorCount} is the total, {@code errors} may be cut short.
 */
public record RunResult(UUID runId,
                        RunStatus status,
                        String dataset,
                        LoadingStrategy strategy,
                        Instant startedAt,
                        Instant finishedAt,
                        StageSummary collection,
                        StageSummary transform,
                        StageSummary load,
                        List<BackendSummary> backends,
                        List<DataVersion> versions,
                        int lowQualityRecords,
                        BigDecimal averageQualityScore,
                        int errorCount,
                        List<ErrorSample> errors) {

    public RunResult {
        collection = collection == null ? StageSummary.empty() : collection;
        transform = transform == null ? StageSummary.empty() : transform;
        load = load == null ? StageSummary.empty() : load;
        backends = backends == null ? List.of() : List.copyOf(backends);
        versions = versions == null ? List.of() : List.copyOf(versions);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static RunResult running(UUID runId, String dataset, LoadingStrategy strategy, Instant startedAt) {
        return new RunResult(runId, RunStatus.RUNNING, dataset, strategy, startedAt, null, null, null, null,
                null, null, 0, null, 0, null);
    }
}
