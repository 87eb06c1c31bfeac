package com.investbyyourself.etl.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content-addressed snapshot of a persisted scope. Two versions with the same
 * {@code versionId} describe byte-identical record sets.
 */
public record DataVersion(String versionId,
                          String dataset,
                          String scopeKey,
                          BackendKind backend,
                          Instant createdAt,
                          int recordCount,
                          String sourceTag,
                          Map<String, String> metadata) {

    public DataVersion {
        metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(metadata));
    }
}
