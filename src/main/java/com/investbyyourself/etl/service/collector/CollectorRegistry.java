package com.investbyyourself.etl.service.collector;

import com.investbyyourself.etl.service.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collectors built from configuration, one per enabled provider.
 */
public class CollectorRegistry {

    private final Map<String, SourceCollector> collectors = new TreeMap<>();

    public CollectorRegistry(List<SourceCollector> collectors) {
        for (SourceCollector collector : collectors) {
            if (this.collectors.putIfAbsent(collector.name(), collector) != null) {
                throw new ConfigurationException("Duplicate collector " + collector.name());
            }
        }
    }

    /**
     * @throws ConfigurationException when a provider is unknown or disabled
     */
    public List<SourceCollector> resolve(List<String> providers) {
        List<SourceCollector> resolved = new ArrayList<>();
        for (String provider : providers) {
            SourceCollector collector = collectors.get(provider);
            if (collector == null) {
                throw new ConfigurationException("Provider '" + provider + "' is not configured or not enabled");
            }
            if (!resolved.contains(collector)) {
                resolved.add(collector);
            }
        }
        return resolved;
    }

    public Map<String, SourceCollector> all() {
        return Collections.unmodifiableMap(collectors);
    }
}
