package com.investbyyourself.etl.service.transform;

import com.investbyyourself.etl.model.MetricValue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Pluggable business rule that derives one metric from canonical decimal fields.
 * The engine only calls {@link #compute} when every required input is present.
 */
public interface MetricCalculator {

    String name();

    /**
     * profitability, liquidity, leverage or valuation.
     */
    String category();

    List<String> requiredInputs();

    /**
     * @return the metric, or a skip reason when the inputs do not allow a value
     */
    Computation compute(Map<String, BigDecimal> inputs);

    record Computation(MetricValue value, String skipReason) {

        public static Computation of(MetricValue value) {
            return new Computation(value, null);
        }

        public static Computation skipped(String reason) {
            return new Computation(null, reason);
        }

        public boolean skipped() {
            return value == null;
        }
    }
}
