package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.DataVersion;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.TransformedRecord;
import com.investbyyourself.etl.service.CancellationToken;

import java.util.List;
import java.util.Optional;

/**
 * One kind of storage. Implementations apply a {@link WritePlan} for a single scope and
 * report connectivity problems as {@link com.investbyyourself.etl.service.BackendUnavailableException}
 * and concurrent modification as {@link com.investbyyourself.etl.service.VersionConflictException}.
 */
public interface StorageBackend {

    BackendKind kind();

    int batchSize();

    /**
     * Loads one scope. Either the whole scope is written or, on failure or cancellation,
     * nothing becomes visible (for the cache backend, nothing new becomes current).
     */
    ScopeLoadOutcome loadScope(String dataset,
                               String scopeKey,
                               List<TransformedRecord> records,
                               LoadingStrategy strategy,
                               CancellationToken token);

    Optional<DataVersion> getVersion(String dataset, String scopeKey);

    /**
     * Checks that the backend is reachable and writable.
     *
     * @throws com.investbyyourself.etl.service.BackendUnavailableException when it is not
     */
    void validate();
}
