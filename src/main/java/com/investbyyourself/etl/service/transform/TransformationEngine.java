package com.investbyyourself.etl.service.transform;

import com.investbyyourself.etl.model.CanonicalValue;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.ErrorSample;
import com.investbyyourself.etl.model.FieldType;
import com.investbyyourself.etl.model.MetricValue;
import com.investbyyourself.etl.model.RawRecord;
import com.investbyyourself.etl.model.RecordFlag;
import com.investbyyourself.etl.model.TransformedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns raw provider records into canonical, enriched records.
 * <p>
 * The output depends only on the raw record set and the rule set: input order, wall
 * clock, capture request ids and thread scheduling never reach a transformed record.
 * Raw records for the same entity and as-of date are merged, with the higher-priority
 * provider winning field conflicts.
 */
@Service
public class TransformationEngine {

    private static final Logger logger = LoggerFactory.getLogger(TransformationEngine.class);

    static final String AS_OF_FIELD = "as_of_date";
    private static final int SCORE_SCALE = 4;

    public TransformResult transform(List<RawRecord> rawRecords, RuleSet ruleSet) {
        long started = System.nanoTime();
        FieldMappingTable mappings = ruleSet.mappings();

        List<RawRecord> ordered = new ArrayList<>(rawRecords);
        ordered.sort(inputOrder(mappings));

        List<ErrorSample> invalid = new ArrayList<>();
        Map<String, List<Normalized>> groups = new TreeMap<>();
        for (RawRecord raw : ordered) {
            Normalized normalized = normalize(raw, mappings);
            if (normalized.rejection != null) {
                invalid.add(new ErrorSample("transform", raw.provider() + ":" + raw.entityKey(),
                        ErrorKind.TRANSFORM_VALIDATION, normalized.rejection));
                continue;
            }
            groups.computeIfAbsent(normalized.recordKey(), k -> new ArrayList<>()).add(normalized);
        }

        Map<String, Map<String, Integer>> skips = new TreeMap<>();
        Map<QualityLevel, Integer> levels = new EnumMap<>(QualityLevel.class);
        List<TransformedRecord> output = new ArrayList<>(groups.size());
        int computed = 0;
        int skipped = 0;
        int implausible = 0;
        int lowQuality = 0;
        BigDecimal scoreSum = BigDecimal.ZERO;

        for (List<Normalized> group : groups.values()) {
            Normalized first = group.get(0);
            TreeMap<String, CanonicalValue> fields = new TreeMap<>();
            TreeMap<String, String> extras = new TreeMap<>();
            List<String> errors = new ArrayList<>();
            Set<String> sources = new TreeSet<>();
            Set<String> expected = new TreeSet<>();
            for (Normalized part : group) {
                part.fields.forEach(fields::putIfAbsent);
                part.extras.forEach(extras::putIfAbsent);
                errors.addAll(part.errors);
                sources.add(part.provider);
                mappings.provider(part.provider).ifPresent(p -> expected.addAll(p.expectedFields()));
            }

            Map<String, BigDecimal> decimals = new TreeMap<>();
            fields.forEach((name, value) -> {
                if (value.type() == FieldType.DECIMAL) {
                    decimals.put(name, value.asDecimal());
                }
            });

            TreeMap<String, MetricValue> metrics = new TreeMap<>();
            for (MetricCalculator calculator : ruleSet.calculators()) {
                Optional<String> missing = calculator.requiredInputs().stream()
                        .filter(input -> !decimals.containsKey(input))
                        .findFirst();
                MetricCalculator.Computation computation = missing.isPresent()
                        ? MetricCalculator.Computation.skipped("missing " + missing.get())
                        : calculator.compute(decimals);
                if (computation.skipped()) {
                    skipped++;
                    skips.computeIfAbsent(calculator.name(), k -> new TreeMap<>())
                            .merge(computation.skipReason(), 1, Integer::sum);
                    continue;
                }
                computed++;
                if (!computation.value().plausible()) {
                    implausible++;
                    errors.add("metric " + calculator.name() + " outside plausible range: "
                            + computation.value().value().toPlainString());
                }
                metrics.put(calculator.name(), computation.value());
            }

            BigDecimal score = qualityScore(expected, fields, metrics);
            List<RecordFlag> flags = new ArrayList<>();
            if (score.compareTo(ruleSet.minQualityScore()) < 0) {
                flags.add(RecordFlag.LOW_QUALITY);
                lowQuality++;
            }
            levels.merge(QualityLevel.of(score), 1, Integer::sum);
            scoreSum = scoreSum.add(score);

            output.add(new TransformedRecord(first.entityKey, first.asOf, List.copyOf(sources), fields, extras,
                    metrics, score, errors, flags));
        }

        BigDecimal average = output.isEmpty()
                ? BigDecimal.ZERO
                : scoreSum.divide(BigDecimal.valueOf(output.size()), SCORE_SCALE, RoundingMode.HALF_UP);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        TransformMetrics metrics = new TransformMetrics(rawRecords.size(), output.size(), invalid.size(), lowQuality,
                computed, skipped, implausible, elapsed);
        logger.info("Transform ruleSet={} raw={} out={} invalid={} lowQuality={} metricsComputed={} metricsSkipped={}",
                ruleSet.version(), rawRecords.size(), output.size(), invalid.size(), lowQuality, computed, skipped);
        return new TransformResult(output, metrics, new QualityReport(skips, levels, average, invalid));
    }

    /**
     * completeness x plausibility, where completeness is the share of the contributing
     * providers' expected fields that are present, and plausibility the share of computed
     * metrics inside their bounds. A factor with nothing to measure counts as 1.
     */
    static BigDecimal qualityScore(Set<String> expected, Map<String, CanonicalValue> fields,
                                   Map<String, MetricValue> metrics) {
        BigDecimal completeness = BigDecimal.ONE;
        if (!expected.isEmpty()) {
            long present = expected.stream().filter(fields::containsKey).count();
            completeness = BigDecimal.valueOf(present).divide(BigDecimal.valueOf(expected.size()), 10, RoundingMode.HALF_UP);
        }
        BigDecimal plausibility = BigDecimal.ONE;
        if (!metrics.isEmpty()) {
            long plausible = metrics.values().stream().filter(MetricValue::plausible).count();
            plausibility = BigDecimal.valueOf(plausible).divide(BigDecimal.valueOf(metrics.size()), 10, RoundingMode.HALF_UP);
        }
        return completeness.multiply(plausibility).setScale(SCORE_SCALE, RoundingMode.HALF_UP);
    }

    private Normalized normalize(RawRecord raw, FieldMappingTable mappings) {
        Normalized n = new Normalized(raw.provider(), raw.entityKey() == null ? "" : raw.entityKey().trim());
        if (n.entityKey.isEmpty()) {
            n.rejection = "missing entity key";
            return n;
        }
        Optional<ProviderMapping> providerMapping = mappings.provider(raw.provider());
        for (Map.Entry<String, Object> entry : raw.payload().entrySet()) {
            FieldMapping mapping = providerMapping.map(p -> p.fields().get(entry.getKey())).orElse(null);
            if (mapping == null) {
                if (entry.getValue() != null) {
                    n.extras.put("extra." + raw.provider() + "." + entry.getKey(), ValueCoercer.asText(entry.getValue()));
                }
                continue;
            }
            CanonicalField field = mappings.canonicalField(mapping.target()).orElseThrow();
            try {
                CanonicalValue value = ValueCoercer.coerce(entry.getValue(), field.type(), mapping.multiplier());
                if (field.type() == FieldType.DECIMAL && !field.inRange(value.asDecimal())) {
                    reportFieldError(n, field, mapping.target() + ": " + value.value() + " out of range");
                    continue;
                }
                n.fields.put(mapping.target(), value);
            } catch (ValueCoercer.CoercionException e) {
                reportFieldError(n, field, mapping.target() + ": " + e.getMessage());
            }
        }
        if (n.rejection != null) {
            return n;
        }
        for (CanonicalField field : mappings.canonicalFields().values()) {
            if (field.required() && providerMapping.isPresent() && !n.fields.containsKey(field.name())) {
                n.rejection = "required field " + field.name() + " missing";
                return n;
            }
        }
        CanonicalValue asOf = n.fields.remove(AS_OF_FIELD);
        n.asOf = asOf != null && asOf.type() == FieldType.DATE
                ? asOf.asDate()
                : LocalDate.ofInstant(raw.capturedAt(), ZoneOffset.UTC);
        return n;
    }

    private void reportFieldError(Normalized n, CanonicalField field, String message) {
        if (field.required() || AS_OF_FIELD.equals(field.name())) {
            n.rejection = message;
        } else {
            n.errors.add(message);
        }
    }

    private static Comparator<RawRecord> inputOrder(FieldMappingTable mappings) {
        return Comparator.<RawRecord>comparingInt(r -> mappings.priority(r.provider()))
                .thenComparing(RawRecord::provider)
                .thenComparing(r -> r.entityKey() == null ? "" : r.entityKey())
                .thenComparing(RawRecord::capturedAt)
                .thenComparing(r -> r.payload().toString());
    }

    private static final class Normalized {
        final String provider;
        final String entityKey;
        final Map<String, CanonicalValue> fields = new TreeMap<>();
        final Map<String, String> extras = new TreeMap<>();
        final List<String> errors = new ArrayList<>();
        LocalDate asOf;
        String rejection;

        Normalized(String provider, String entityKey) {
            this.provider = provider;
            this.entityKey = entityKey;
        }

        String recordKey() {
            return entityKey + "@" + asOf;
        }
    }
}
