package com.investbyyourself.etl.service.transform;

import java.math.BigDecimal;

public enum QualityLevel {
    EXCELLENT(new BigDecimal("0.95")),
    GOOD(new BigDecimal("0.80")),
    FAIR(new BigDecimal("0.60")),
    POOR(new BigDecimal("0.40")),
    UNUSABLE(BigDecimal.ZERO);

    private final BigDecimal threshold;

    QualityLevel(BigDecimal threshold) {
        this.threshold = threshold;
    }

    public static QualityLevel of(BigDecimal score) {
        for (QualityLevel level : values()) {
            if (score.compareTo(level.threshold) >= 0) {
                return level;
            }
        }
        return UNUSABLE;
    }
}
