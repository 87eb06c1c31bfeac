package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.DataVersion;
import com.investbyyourself.etl.model.ErrorSample;
import com.investbyyourself.etl.model.LoadingMetrics;
import com.investbyyourself.etl.model.TransformedRecord;

import java.time.Duration;
import java.util.List;

/**
 * Result of one committed scope load.
 *
 * @param version        the scope's version after the load, null if it never had one
 * @param versionCreated whether this load created {@code version}
 */
public record ScopeLoadOutcome(String scopeKey,
                               LoadingMetrics metrics,
                               DataVersion version,
                               boolean versionCreated,
                               List<ErrorSample> recordFailures) {

    public ScopeLoadOutcome {
        recordFailures = List.copyOf(recordFailures);
    }

    static ScopeLoadOutcome from(String scopeKey,
                                 List<TransformedRecord> records,
                                 WritePlan plan,
                                 DataVersion version,
                                 boolean versionCreated,
                                 Duration elapsed) {
        LoadingMetrics metrics = new LoadingMetrics(records.size(), plan.inserts().size(), plan.updates().size(),
                plan.deletes().size(), plan.skipped(), plan.failures().size(), elapsed);
        return new ScopeLoadOutcome(scopeKey, metrics, version, versionCreated, plan.failures());
    }
}
