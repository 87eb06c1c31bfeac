package com.investbyyourself.etl.model;

import java.math.BigDecimal;

/**
 * A computed financial metric.
 *
 * @param value      rounded to a fixed scale by the calculator
 * @param unit       {@code percent} or {@code ratio}
 * @param confidence 1 when the value passed its plausibility bounds, 0 otherwise
 */
public record MetricValue(BigDecimal value, String unit, BigDecimal confidence) {

    public boolean plausible() {
        return confidence.signum() > 0;
    }
}
