package com.investbyyourself.etl.service.collector;

import com.investbyyourself.etl.service.CancellationToken;

/**
 * One external data source. Implementations own their rate limit and retry state and
 * must not share it with other collectors.
 */
public interface SourceCollector {

    String name();

    /**
     * Merge priority; lower values win conflicts and are dispatched first.
     */
    int priority();

    /**
     * Fetches every requested entity key. A failing key is reported in the result and
     * never aborts the remaining keys.
     */
    CollectionResult collect(CollectionRequest request, CancellationToken token);
}
