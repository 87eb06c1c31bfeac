package com.investbyyourself.etl.service.collector;

import com.investbyyourself.etl.model.CollectionMetrics;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.RawRecord;

import java.util.List;

/**
 * Output of one collector. {@code error} is set only when the collector as a whole
 * failed (crash, timeout, cancellation); per-key failures are listed in {@code failures}.
 */
public record CollectionResult(String collectorName,
                               int priority,
                               List<RawRecord> records,
                               CollectionMetrics metrics,
                               List<KeyFailure> failures,
                               ErrorKind error,
                               String errorMessage) {

    public CollectionResult {
        records = records == null ? List.of() : List.copyOf(records);
        failures = failures == null ? List.of() : List.copyOf(failures);
        metrics = metrics == null ? CollectionMetrics.empty() : metrics;
    }

    public static CollectionResult failed(String collectorName, int priority, ErrorKind kind, String message) {
        return new CollectionResult(collectorName, priority, List.of(), CollectionMetrics.empty(), List.of(),
                kind, message);
    }

    public boolean collectorFailed() {
        return error != null;
    }
}
