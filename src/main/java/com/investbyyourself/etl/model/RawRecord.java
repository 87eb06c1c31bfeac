package com.investbyyourself.etl.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One untyped observation as a provider returned it.
 *
 * @param provider    provider identifier (e.g. {@code alphavantage})
 * @param entityKey   ticker or series id
 * @param capturedAt  when the collector captured it
 * @param payload     provider field name to raw value, copied and frozen on construction
 * @param provenance  source name and request id
 */
public record RawRecord(String provider,
                        String entityKey,
                        Instant capturedAt,
                        Map<String, Object> payload,
                        Provenance provenance) {

    public RawRecord {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(capturedAt, "capturedAt");
        payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(payload));
    }
}
