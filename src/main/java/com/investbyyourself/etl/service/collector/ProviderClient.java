package com.investbyyourself.etl.service.collector;

import com.investbyyourself.etl.model.TimeWindow;

import java.util.List;
import java.util.Map;

/**
 * Transport adapter for one provider API. Translates the provider's wire format into
 * untyped payload maps, one per observation.
 */
public interface ProviderClient {

    String providerName();

    /**
     * Number of HTTP calls one {@link #fetch} issues, charged against the rate budget.
     */
    default int callsPerFetch() {
        return 1;
    }

    List<Map<String, Object>> fetch(String entityKey, TimeWindow window) throws ProviderCallException;
}
