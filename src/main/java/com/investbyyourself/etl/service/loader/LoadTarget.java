package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.ScopeGranularity;
import com.investbyyourself.etl.model.TransformedRecord;

import java.util.EnumSet;
import java.util.Set;

/**
 * Where and how to load: dataset name, backends, scope granularity and whether
 * records flagged low quality are held back.
 */
public record LoadTarget(String dataset, Set<BackendKind> backends, ScopeGranularity granularity,
                         boolean dropLowQuality) {

    public LoadTarget {
        if (dataset == null || dataset.isBlank()) {
            throw new IllegalArgumentException("dataset is required");
        }
        backends = backends == null || backends.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(backends));
        granularity = granularity == null ? ScopeGranularity.ENTITY : granularity;
    }

    public String scopeKey(TransformedRecord record) {
        return granularity == ScopeGranularity.ENTITY_DATE ? record.recordKey() : record.entityKey();
    }
}
