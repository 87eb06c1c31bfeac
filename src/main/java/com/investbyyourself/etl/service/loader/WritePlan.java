package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.ErrorSample;
import com.investbyyourself.etl.model.TransformedRecord;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What a backend has to write to apply one strategy to one scope.
 *
 * @param inserts           new rows, with their checksums
 * @param updates           existing rows to overwrite
 * @param deletes           row ids to remove
 * @param skipped           incoming records deliberately not written
 * @param failures          incoming records rejected by the strategy
 * @param resultingRows     full scope contents once the plan is applied
 * @param resultingVersionId content hash of {@code resultingRows}
 * @param unchanged         true when the scope content would not change; no write and no
 *                          new version should follow
 */
public record WritePlan(List<PlannedRow> inserts,
                        List<PlannedRow> updates,
                        List<String> deletes,
                        int skipped,
                        List<ErrorSample> failures,
                        List<PlannedRow> resultingRows,
                        String resultingVersionId,
                        boolean unchanged) {

    public WritePlan {
        inserts = List.copyOf(inserts);
        updates = List.copyOf(updates);
        deletes = List.copyOf(deletes);
        failures = List.copyOf(failures);
        resultingRows = List.copyOf(resultingRows);
    }

    /**
     * Sorted, comma-separated providers that contributed to the resulting scope content.
     */
    public String sourceTag() {
        return resultingRows.stream()
                .flatMap(r -> r.record().sources().stream())
                .distinct()
                .sorted()
                .collect(Collectors.joining(","));
    }

    public int writeCount() {
        return inserts.size() + updates.size() + deletes.size();
    }

    /**
     * @param rowId existing row id for updates and kept rows, null for inserts
     */
    public record PlannedRow(String rowId, String checksum, TransformedRecord record) {
    }
}
