package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.DataVersion;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.TransformedRecord;
import com.investbyyourself.etl.service.ContentHashingService;
import com.investbyyourself.etl.service.RecordJsonCodec;
import com.investbyyourself.etl.support.TestRecords;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyPlannerTest {

    private final ContentHashingService hashingService = new ContentHashingService(new RecordJsonCodec());
    private final StrategyPlanner planner = new StrategyPlanner(hashingService);

    private StoredRecord stored(String rowId, TransformedRecord record) {
        return new StoredRecord(rowId, hashingService.recordChecksum(record), record);
    }

    private ScopeState state(StoredRecord... rows) {
        return new ScopeState(List.of(rows), null);
    }

    private ScopeState applied(WritePlan plan) {
        List<StoredRecord> rows = new ArrayList<>();
        int i = 0;
        for (WritePlan.PlannedRow row : plan.resultingRows()) {
            rows.add(new StoredRecord(row.rowId() != null ? row.rowId() : "new-" + i++, row.checksum(), row.record()));
        }
        DataVersion version = new DataVersion(plan.resultingVersionId(), "fundamentals", "AAPL",
                BackendKind.RELATIONAL, Instant.EPOCH, rows.size(), plan.sourceTag(), Map.of());
        return new ScopeState(rows, version);
    }

    @Test
    void insertOnlyRejectsExistingKeys() {
        WritePlan plan = planner.plan(state(stored("r1", TestRecords.record("AAPL", "1"))),
                List.of(TestRecords.record("AAPL", "2"), TestRecords.record("AAPL", TestRecords.AS_OF.minusDays(1), "3")),
                LoadingStrategy.INSERT_ONLY);

        assertThat(plan.inserts()).hasSize(1);
        assertThat(plan.failures()).singleElement()
                .satisfies(f -> assertThat(f.kind()).isEqualTo(ErrorKind.LOAD_FAILED));
        assertThat(plan.resultingRows()).hasSize(2);
    }

    @Test
    void updateOnlyMergesExistingAndSkipsNewKeys() {
        TransformedRecord existing = TestRecords.record("AAPL", "1");
        WritePlan plan = planner.plan(state(stored("r1", existing)),
                List.of(TestRecords.record("AAPL", "2"), TestRecords.record("MSFT", "3")),
                LoadingStrategy.UPDATE_ONLY);

        assertThat(plan.inserts()).isEmpty();
        assertThat(plan.updates()).singleElement()
                .satisfies(u -> {
                    assertThat(u.rowId()).isEqualTo("r1");
                    assertThat(u.record().canonicalFields().get("price").value()).isEqualTo("2");
                });
        assertThat(plan.skipped()).isEqualTo(1);
    }

    @Test
    void upsertKeepsStoredFieldsMissingFromIncomingRecord() {
        TransformedRecord existing = TestRecords.record("AAPL", "1");
        TransformedRecord partial = new TransformedRecord("AAPL", TestRecords.AS_OF, List.of("alphavantage"),
                new java.util.TreeMap<>(Map.of("price", com.investbyyourself.etl.model.CanonicalValue.decimal(
                        new java.math.BigDecimal("5")))), null, null, java.math.BigDecimal.ONE, null, null);

        WritePlan plan = planner.plan(state(stored("r1", existing)), List.of(partial), LoadingStrategy.UPSERT);

        TransformedRecord merged = plan.updates().get(0).record();
        assertThat(merged.canonicalFields()).containsKeys("name", "price");
        assertThat(merged.canonicalFields().get("price").value()).isEqualTo("5");
        assertThat(merged.sources()).containsExactly("alphavantage", "yahoo");
    }

    @Test
    void upsertCollapsesDuplicateKeysInOneBatch() {
        WritePlan plan = planner.plan(ScopeState.empty(),
                List.of(TestRecords.record("AAPL", "1"), TestRecords.record("AAPL", "2")), LoadingStrategy.UPSERT);

        assertThat(plan.inserts()).singleElement()
                .satisfies(i -> assertThat(i.record().canonicalFields().get("price").value()).isEqualTo("2"));
    }

    @Test
    void replaceDeletesEverythingAndInsertsIncoming() {
        WritePlan plan = planner.plan(state(stored("r1", TestRecords.record("AAPL", "1")),
                        stored("r2", TestRecords.record("AAPL", TestRecords.AS_OF.minusDays(9), "1"))),
                TestRecords.series("AAPL", 3), LoadingStrategy.REPLACE);

        assertThat(plan.deletes()).containsExactly("r1", "r2");
        assertThat(plan.inserts()).hasSize(3);
        assertThat(plan.resultingRows()).hasSize(3);
    }

    @Test
    void appendAlwaysInserts() {
        WritePlan plan = planner.plan(state(stored("r1", TestRecords.record("AAPL", "1"))),
                List.of(TestRecords.record("AAPL", "1")), LoadingStrategy.APPEND);

        assertThat(plan.inserts()).hasSize(1);
        assertThat(plan.resultingRows()).hasSize(2);
        assertThat(plan.unchanged()).isFalse();
    }

    @Test
    void incrementalWritesOnlyChangedRecordsAndIsIdempotent() {
        List<TransformedRecord> batch = TestRecords.series("AAPL", 5);
        WritePlan first = planner.plan(ScopeState.empty(), batch, LoadingStrategy.INCREMENTAL);
        assertThat(first.inserts()).hasSize(5);

        ScopeState after = applied(first);
        WritePlan second = planner.plan(after, batch, LoadingStrategy.INCREMENTAL);
        assertThat(second.unchanged()).isTrue();
        assertThat(second.writeCount()).isZero();
        assertThat(second.skipped()).isEqualTo(5);
        assertThat(second.resultingVersionId()).isEqualTo(first.resultingVersionId());

        List<TransformedRecord> changed = new ArrayList<>(batch);
        changed.set(0, TestRecords.record("AAPL", TestRecords.AS_OF, "999"));
        WritePlan third = planner.plan(after, changed, LoadingStrategy.INCREMENTAL);
        assertThat(third.updates()).hasSize(1);
        assertThat(third.skipped()).isEqualTo(4);
        assertThat(third.resultingVersionId()).isNotEqualTo(first.resultingVersionId());
    }

    @Test
    void versionIdDependsOnContentNotInputOrder() {
        List<TransformedRecord> batch = TestRecords.series("AAPL", 4);
        List<TransformedRecord> reversed = new ArrayList<>(batch);
        java.util.Collections.reverse(reversed);

        assertThat(planner.plan(ScopeState.empty(), reversed, LoadingStrategy.REPLACE).resultingVersionId())
                .isEqualTo(planner.plan(ScopeState.empty(), batch, LoadingStrategy.REPLACE).resultingVersionId());
    }

    @Test
    void incrementalWritesWhenVersionIsKnownButRowsAreMissing() {
        List<TransformedRecord> batch = TestRecords.series("AAPL", 2);
        ScopeState loaded = applied(planner.plan(ScopeState.empty(), batch, LoadingStrategy.INCREMENTAL));
        ScopeState rowsGone = new ScopeState(List.of(), loaded.currentVersion());

        WritePlan plan = planner.plan(rowsGone, batch, LoadingStrategy.INCREMENTAL);

        assertThat(plan.resultingVersionId()).isEqualTo(loaded.currentVersionId());
        assertThat(plan.unchanged()).isFalse();
        assertThat(plan.inserts()).hasSize(2);
        assertThat(plan.skipped()).isZero();
    }
}
