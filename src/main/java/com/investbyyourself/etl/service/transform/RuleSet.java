package com.investbyyourself.etl.service.transform;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

/**
 * Everything a transformation depends on besides its input. Calculators run in name
 * order regardless of registration order.
 */
public record RuleSet(String version,
                      FieldMappingTable mappings,
                      List<MetricCalculator> calculators,
                      BigDecimal minQualityScore) {

    public RuleSet {
        calculators = calculators.stream()
                .sorted(Comparator.comparing(MetricCalculator::name))
                .toList();
    }
}
