package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.DataVersion;

import java.util.List;

/**
 * Persisted contents of one scope plus its latest version, null when never loaded.
 */
public record ScopeState(List<StoredRecord> rows, DataVersion currentVersion) {

    public ScopeState {
        rows = List.copyOf(rows);
    }

    public static ScopeState empty() {
        return new ScopeState(List.of(), null);
    }

    public String currentVersionId() {
        return currentVersion == null ? null : currentVersion.versionId();
    }
}
