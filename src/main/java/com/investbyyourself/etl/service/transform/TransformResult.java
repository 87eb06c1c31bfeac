package com.investbyyourself.etl.service.transform;

import com.investbyyourself.etl.model.TransformedRecord;

import java.util.List;

public record TransformResult(List<TransformedRecord> records, TransformMetrics metrics, QualityReport qualityReport) {

    public TransformResult {
        records = List.copyOf(records);
    }
}
