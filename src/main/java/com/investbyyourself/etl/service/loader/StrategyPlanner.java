package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.ErrorSample;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.TransformedRecord;
import com.investbyyourself.etl.service.ContentHashingService;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reconciles incoming records against a scope's stored state. Pure: the same state,
 * records and strategy always give the same plan, whichever backend applies it.
 */
@Component
public class StrategyPlanner {

    private final ContentHashingService hashingService;

    public StrategyPlanner(ContentHashingService hashingService) {
        this.hashingService = hashingService;
    }

    public WritePlan plan(ScopeState state, List<TransformedRecord> incoming, LoadingStrategy strategy) {
        // rows keyed by record key; the last stored row wins when appends left duplicates
        Map<String, StoredRecord> byKey = new LinkedHashMap<>();
        for (StoredRecord row : state.rows()) {
            byKey.put(row.recordKey(), row);
        }

        List<WritePlan.PlannedRow> inserts = new ArrayList<>();
        Map<String, WritePlan.PlannedRow> updates = new LinkedHashMap<>();
        List<String> deletes = new ArrayList<>();
        List<ErrorSample> failures = new ArrayList<>();
        Set<String> insertedKeys = new HashSet<>();
        int skipped = 0;

        if (strategy == LoadingStrategy.REPLACE) {
            state.rows().forEach(row -> deletes.add(row.rowId()));
        }

        for (TransformedRecord record : incoming) {
            String key = record.recordKey();
            StoredRecord stored = byKey.get(key);
            WritePlan.PlannedRow pendingUpdate = stored == null ? null : updates.get(stored.rowId());
            TransformedRecord current = pendingUpdate != null ? pendingUpdate.record() : stored == null ? null : stored.record();
            boolean exists = stored != null || insertedKeys.contains(key);

            switch (strategy) {
                case INSERT_ONLY -> {
                    if (exists) {
                        failures.add(new ErrorSample("load", key, ErrorKind.LOAD_FAILED,
                                "key already exists, INSERT_ONLY does not overwrite"));
                    } else {
                        inserts.add(row(null, record));
                        insertedKeys.add(key);
                    }
                }
                case UPDATE_ONLY -> {
                    if (stored == null) {
                        skipped++;
                    } else {
                        updates.put(stored.rowId(), row(stored.rowId(), record.mergeOnto(current)));
                    }
                }
                case UPSERT -> {
                    if (stored != null) {
                        updates.put(stored.rowId(), row(stored.rowId(), record.mergeOnto(current)));
                    } else {
                        insertOnce(inserts, insertedKeys, record);
                    }
                }
                case REPLACE -> insertOnce(inserts, insertedKeys, record);
                case APPEND -> inserts.add(row(null, record));
                case INCREMENTAL -> {
                    String checksum = hashingService.recordChecksum(record);
                    if (stored == null) {
                        insertOnce(inserts, insertedKeys, record);
                    } else if (Objects.equals(stored.checksum(), checksum) && pendingUpdate == null) {
                        skipped++;
                    } else {
                        updates.put(stored.rowId(), new WritePlan.PlannedRow(stored.rowId(), checksum, record));
                    }
                }
                default -> throw new IllegalArgumentException("Unsupported strategy " + strategy);
            }
        }

        List<WritePlan.PlannedRow> resulting = new ArrayList<>();
        Set<String> deleted = new HashSet<>(deletes);
        for (StoredRecord row : state.rows()) {
            if (deleted.contains(row.rowId())) {
                continue;
            }
            WritePlan.PlannedRow updated = updates.get(row.rowId());
            resulting.add(updated != null ? updated : new WritePlan.PlannedRow(row.rowId(), row.checksum(), row.record()));
        }
        resulting.addAll(inserts);

        List<String> checksums = resulting.stream().map(WritePlan.PlannedRow::checksum).toList();
        String versionId = hashingService.versionId(checksums);

        List<WritePlan.PlannedRow> updateRows = new ArrayList<>(updates.values());
        // decided from the rows actually read; an equal version id alone proves nothing
        boolean unchanged = inserts.isEmpty() && updateRows.isEmpty() && deletes.isEmpty();
        return new WritePlan(inserts, updateRows, deletes, skipped, failures, resulting, versionId, unchanged);
    }

    /**
     * Inserts a key once; a repeated key in the same batch replaces the earlier pending insert.
     */
    private void insertOnce(List<WritePlan.PlannedRow> inserts, Set<String> insertedKeys, TransformedRecord record) {
        String key = record.recordKey();
        if (insertedKeys.add(key)) {
            inserts.add(row(null, record));
            return;
        }
        for (int i = 0; i < inserts.size(); i++) {
            if (inserts.get(i).record().recordKey().equals(key)) {
                inserts.set(i, row(null, record));
                return;
            }
        }
    }

    private WritePlan.PlannedRow row(String rowId, TransformedRecord record) {
        return new WritePlan.PlannedRow(rowId, hashingService.recordChecksum(record), record);
    }
}
