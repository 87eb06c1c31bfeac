package com.investbyyourself.etl.service.transform;

import com.investbyyourself.etl.model.ErrorSample;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * @param skippedCalculators calculator name to {@code reason -> count}
 * @param levels             number of output records per quality level
 * @param averageScore       mean score of output records, 0 when there are none
 * @param invalidRecords     why excluded raw records were rejected
 */
public record QualityReport(Map<String, Map<String, Integer>> skippedCalculators,
                            Map<QualityLevel, Integer> levels,
                            BigDecimal averageScore,
                            List<ErrorSample> invalidRecords) {
}
