package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.DataVersion;
import com.investbyyourself.etl.model.ErrorSample;
import com.investbyyourself.etl.model.LoadingMetrics;

import java.util.List;

/**
 * Outcome of one load across all requested backends.
 *
 * @param heldBack records not offered to any backend because of the low-quality policy
 */
public record LoadResult(List<BackendLoadResult> backends, int heldBack) {

    public LoadResult {
        backends = List.copyOf(backends);
    }

    public LoadingMetrics metrics() {
        LoadingMetrics total = LoadingMetrics.empty();
        for (BackendLoadResult backend : backends) {
            total = total.plus(backend.metrics());
        }
        return total;
    }

    public List<DataVersion> versions() {
        return backends.stream().flatMap(b -> b.versions().stream()).toList();
    }

    public List<ErrorSample> errors() {
        return backends.stream().flatMap(b -> b.errors().stream()).toList();
    }

    public boolean anyFailure() {
        return backends.stream().anyMatch(b -> b.backendFailed() || !b.errors().isEmpty());
    }
}
