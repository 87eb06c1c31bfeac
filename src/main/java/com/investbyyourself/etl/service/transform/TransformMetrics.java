package com.investbyyourself.etl.service.transform;

import java.time.Duration;

public record TransformMetrics(int inputRecords,
                               int outputRecords,
                               int invalidRecords,
                               int lowQualityRecords,
                               int metricsComputed,
                               int metricsSkipped,
                               int implausibleMetrics,
                               Duration duration) {
}
