package com.investbyyourself.etl.service.transform;

import com.investbyyourself.etl.model.MetricValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code (n0 - n1 - ... ) * factor / denominator}, rounded HALF_UP to six places.
 * Values outside the plausibility bounds are kept with confidence 0.
 */
public class RatioMetricCalculator implements MetricCalculator {

    public static final int SCALE = 6;

    private final String name;
    private final String category;
    private final List<String> numeratorTerms;
    private final String denominator;
    private final String unit;
    private final BigDecimal factor;
    private final BigDecimal min;
    private final BigDecimal max;

    public RatioMetricCalculator(String name,
                                 String category,
                                 List<String> numeratorTerms,
                                 String denominator,
                                 String unit,
                                 BigDecimal factor,
                                 BigDecimal min,
                                 BigDecimal max) {
        if (numeratorTerms.isEmpty()) {
            throw new IllegalArgumentException("Metric " + name + " needs at least one numerator term");
        }
        this.name = name;
        this.category = category;
        this.numeratorTerms = List.copyOf(numeratorTerms);
        this.denominator = denominator;
        this.unit = unit;
        this.factor = factor;
        this.min = min;
        this.max = max;
    }

    public static RatioMetricCalculator percent(String name, String category, String numerator, String denominator,
                                                BigDecimal min, BigDecimal max) {
        return new RatioMetricCalculator(name, category, List.of(numerator), denominator, "percent",
                BigDecimal.valueOf(100), min, max);
    }

    public static RatioMetricCalculator ratio(String name, String category, String numerator, String denominator,
                                              BigDecimal min, BigDecimal max) {
        return new RatioMetricCalculator(name, category, List.of(numerator), denominator, "ratio",
                BigDecimal.ONE, min, max);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String category() {
        return category;
    }

    @Override
    public List<String> requiredInputs() {
        List<String> inputs = new ArrayList<>(numeratorTerms);
        inputs.add(denominator);
        return inputs;
    }

    @Override
    public Computation compute(Map<String, BigDecimal> inputs) {
        BigDecimal divisor = inputs.get(denominator);
        if (divisor.signum() == 0) {
            return Computation.skipped("zero " + denominator);
        }
        BigDecimal numerator = inputs.get(numeratorTerms.get(0));
        for (String term : numeratorTerms.subList(1, numeratorTerms.size())) {
            numerator = numerator.subtract(inputs.get(term));
        }
        BigDecimal value = numerator.multiply(factor).divide(divisor, SCALE, RoundingMode.HALF_UP);
        boolean plausible = (min == null || value.compareTo(min) >= 0) && (max == null || value.compareTo(max) <= 0);
        return Computation.of(new MetricValue(value, unit, plausible ? BigDecimal.ONE : BigDecimal.ZERO));
    }
}
