package com.investbyyourself.etl.service.collector;

import com.investbyyourself.etl.model.CollectionMetrics;
import com.investbyyourself.etl.model.RawRecord;

import java.util.List;

/**
 * Merged output of one orchestrator run. {@code records} are ordered by collector
 * priority, collector name, entity key and capture time.
 */
public record OrchestratorResult(List<RawRecord> records,
                                 List<CollectionResult> collectorResults,
                                 CollectionMetrics totals,
                                 boolean cancelled) {

    public OrchestratorResult {
        records = List.copyOf(records);
        collectorResults = List.copyOf(collectorResults);
    }

    public List<CollectionResult> failedCollectors() {
        return collectorResults.stream().filter(CollectionResult::collectorFailed).toList();
    }
}
