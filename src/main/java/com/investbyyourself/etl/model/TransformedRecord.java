package com.investbyyourself.etl.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Normalised, enriched record ready for loading. Instances are never mutated; merging
 * produces a new record that supersedes the stored one.
 */
public record TransformedRecord(String entityKey,
                                LocalDate asOf,
                                List<String> sources,
                                SortedMap<String, CanonicalValue> canonicalFields,
                                SortedMap<String, String> extras,
                                SortedMap<String, MetricValue> metrics,
                                BigDecimal qualityScore,
                                List<String> validationErrors,
                                List<RecordFlag> flags) {

    public TransformedRecord {
        Objects.requireNonNull(entityKey, "entityKey");
        Objects.requireNonNull(asOf, "asOf");
        sources = List.copyOf(new TreeSet<>(sources == null ? List.of() : sources));
        canonicalFields = freeze(canonicalFields);
        extras = freeze(extras);
        metrics = freeze(metrics);
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
        flags = List.copyOf(new TreeSet<>(flags == null ? List.of() : flags));
    }

    /**
     * Key that identifies this record inside a dataset: entity plus as-of date.
     */
    public String recordKey() {
        return entityKey + "@" + asOf;
    }

    public boolean lowQuality() {
        return flags.contains(RecordFlag.LOW_QUALITY);
    }

    /**
     * Field-by-field merge onto a stored record: fields present here win, fields only
     * present in {@code stored} are kept. Quality score, validation errors and flags are
     * taken from this record.
     */
    public TransformedRecord mergeOnto(TransformedRecord stored) {
        if (stored == null) {
            return this;
        }
        TreeMap<String, CanonicalValue> fields = new TreeMap<>(stored.canonicalFields());
        fields.putAll(canonicalFields);
        TreeMap<String, String> mergedExtras = new TreeMap<>(stored.extras());
        mergedExtras.putAll(extras);
        TreeMap<String, MetricValue> mergedMetrics = new TreeMap<>(stored.metrics());
        mergedMetrics.putAll(metrics);
        TreeSet<String> mergedSources = new TreeSet<>(stored.sources());
        mergedSources.addAll(sources);
        return new TransformedRecord(entityKey, asOf, List.copyOf(mergedSources), fields, mergedExtras,
                mergedMetrics, qualityScore, validationErrors, flags);
    }

    private static <V> SortedMap<String, V> freeze(SortedMap<String, V> map) {
        return Collections.unmodifiableSortedMap(map == null ? new TreeMap<>() : new TreeMap<>(map));
    }
}
