package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.DataVersion;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.TransformedRecord;
import com.investbyyourself.etl.service.BackendUnavailableException;
import com.investbyyourself.etl.service.CancellationToken;
import com.investbyyourself.etl.service.ContentHashingService;
import com.investbyyourself.etl.service.EtlException;
import com.investbyyourself.etl.service.RecordJsonCodec;
import com.investbyyourself.etl.service.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL store. Each scope load runs in its own transaction: rows, the scope's
 * revision marker and the version audit row commit together or not at all. A concurrent
 * writer is detected through the optimistic {@code load_scopes.revision} column.
 */
public class RelationalStorageBackend implements StorageBackend {

    private static final Logger logger = LoggerFactory.getLogger(RelationalStorageBackend.class);

    static final String SELECT_SCOPE =
            "SELECT version_id, revision FROM load_scopes WHERE dataset = ? AND scope_key = ?";
    static final String SELECT_ROWS =
            "SELECT row_id, record_checksum, record_json FROM financial_records "
                    + "WHERE dataset = ? AND scope_key = ? ORDER BY loaded_at, row_id";
    static final String SELECT_VERSION =
            "SELECT version_id, dataset, scope_key, created_at, record_count, source_tag, metadata "
                    + "FROM data_versions WHERE dataset = ? AND scope_key = ? AND backend = 'RELATIONAL' "
                    + "ORDER BY created_at DESC LIMIT 1";
    static final String INSERT_ROW =
            "INSERT INTO financial_records (row_id, dataset, scope_key, record_key, entity_key, as_of, "
                    + "record_json, quality_score, low_quality, record_checksum, loaded_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?, ?, ?)";
    static final String UPDATE_ROW =
            "UPDATE financial_records SET record_json = CAST(? AS jsonb), quality_score = ?, low_quality = ?, "
                    + "record_checksum = ?, loaded_at = ? WHERE row_id = ?";
    static final String DELETE_ROW = "DELETE FROM financial_records WHERE row_id = ?";
    static final String INSERT_SCOPE =
            "INSERT INTO load_scopes (dataset, scope_key, version_id, revision, updated_at) VALUES (?, ?, ?, 1, ?)";
    static final String UPDATE_SCOPE =
            "UPDATE load_scopes SET version_id = ?, revision = revision + 1, updated_at = ? "
                    + "WHERE dataset = ? AND scope_key = ? AND revision = ?";
    static final String INSERT_VERSION =
            "INSERT INTO data_versions (audit_id, version_id, dataset, backend, scope_key, record_count, "
                    + "source_tag, metadata, created_at) VALUES (?, ?, ?, 'RELATIONAL', ?, ?, ?, CAST(? AS jsonb), ?)";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final StrategyPlanner planner;
    private final RecordJsonCodec codec;
    private final int batchSize;
    private final Clock clock;

    public RelationalStorageBackend(JdbcTemplate jdbcTemplate,
                                    TransactionTemplate transactionTemplate,
                                    StrategyPlanner planner,
                                    RecordJsonCodec codec,
                                    int batchSize,
                                    Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.planner = planner;
        this.codec = codec;
        this.batchSize = batchSize;
        this.clock = clock;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.RELATIONAL;
    }

    @Override
    public int batchSize() {
        return batchSize;
    }

    @Override
    public ScopeLoadOutcome loadScope(String dataset,
                                      String scopeKey,
                                      List<TransformedRecord> records,
                                      LoadingStrategy strategy,
                                      CancellationToken token) {
        try {
            return transactionTemplate.execute(status -> loadInTransaction(dataset, scopeKey, records, strategy, token));
        } catch (DuplicateKeyException e) {
            throw new VersionConflictException("Scope " + scopeKey + " was created concurrently");
        } catch (DataAccessResourceFailureException | TransientDataAccessException | TransactionException e) {
            throw new BackendUnavailableException("Relational store unavailable: " + e.getMessage(), e);
        } catch (DataAccessException e) {
            throw new EtlException(ErrorKind.LOAD_FAILED, "Relational load of scope " + scopeKey + " failed: "
                    + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private ScopeLoadOutcome loadInTransaction(String dataset,
                                               String scopeKey,
                                               List<TransformedRecord> records,
                                               LoadingStrategy strategy,
                                               CancellationToken token) {
        Instant started = clock.instant();
        List<ScopeMarker> markers = jdbcTemplate.query(SELECT_SCOPE,
                (rs, i) -> new ScopeMarker(rs.getString("version_id"), rs.getLong("revision")),
                dataset, scopeKey);
        ScopeMarker marker = markers.isEmpty() ? null : markers.get(0);
        DataVersion current = marker == null ? null : currentVersion(dataset, scopeKey).orElse(null);

        List<StoredRecord> rows = jdbcTemplate.query(SELECT_ROWS,
                (rs, i) -> new StoredRecord(rs.getString("row_id"), rs.getString("record_checksum"),
                        codec.readRecord(rs.getString("record_json"))),
                dataset, scopeKey);
        WritePlan plan = planner.plan(new ScopeState(rows, current), records, strategy);
        if (plan.unchanged()) {
            return ScopeLoadOutcome.from(scopeKey, records, plan, current, false,
                    Duration.between(started, clock.instant()));
        }

        Timestamp now = Timestamp.from(clock.instant());
        inBatches(DELETE_ROW, plan.deletes().stream().map(id -> new Object[]{id}).toList(), token, scopeKey);
        List<Object[]> updateArgs = new ArrayList<>();
        for (WritePlan.PlannedRow row : plan.updates()) {
            TransformedRecord r = row.record();
            updateArgs.add(new Object[]{codec.toJson(r), r.qualityScore(), r.lowQuality(), row.checksum(), now,
                    row.rowId()});
        }
        inBatches(UPDATE_ROW, updateArgs, token, scopeKey);
        List<Object[]> insertArgs = new ArrayList<>();
        for (WritePlan.PlannedRow row : plan.inserts()) {
            TransformedRecord r = row.record();
            insertArgs.add(new Object[]{UUID.randomUUID().toString(), dataset, scopeKey, r.recordKey(), r.entityKey(),
                    Date.valueOf(r.asOf()), codec.toJson(r), r.qualityScore(), r.lowQuality(),
                    row.checksum(), now});
        }
        inBatches(INSERT_ROW, insertArgs, token, scopeKey);

        String versionId = plan.resultingVersionId();
        if (marker == null) {
            jdbcTemplate.update(INSERT_SCOPE, dataset, scopeKey, versionId, now);
        } else {
            int updated = jdbcTemplate.update(UPDATE_SCOPE, versionId, now, dataset, scopeKey, marker.revision());
            if (updated == 0) {
                throw new VersionConflictException("Scope " + scopeKey + " changed since revision "
                        + marker.revision());
            }
        }

        DataVersion version = current;
        boolean created = false;
        if (current == null || !versionId.equals(current.versionId())) {
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("strategy", strategy.name());
            if (current != null) {
                metadata.put("previousVersionId", current.versionId());
            }
            version = new DataVersion(versionId, dataset, scopeKey, kind(), now.toInstant(),
                    plan.resultingRows().size(), plan.sourceTag(), metadata);
            jdbcTemplate.update(INSERT_VERSION, UUID.randomUUID(), versionId, dataset, scopeKey,
                    version.recordCount(), version.sourceTag(), codec.write(metadata), now);
            created = true;
        }

        token.throwIfCancelled("relational load of scope " + scopeKey);
        logger.info("backend=RELATIONAL dataset={} scope={} inserted={} updated={} deleted={} version={}",
                dataset, scopeKey, plan.inserts().size(), plan.updates().size(), plan.deletes().size(), versionId);
        return ScopeLoadOutcome.from(scopeKey, records, plan, version, created,
                Duration.between(started, clock.instant()));
    }

    private void inBatches(String sql, List<Object[]> args, CancellationToken token, String scopeKey) {
        for (int from = 0; from < args.size(); from += batchSize) {
            token.throwIfCancelled("relational load of scope " + scopeKey);
            jdbcTemplate.batchUpdate(sql, args.subList(from, Math.min(args.size(), from + batchSize)));
        }
    }

    @Override
    public Optional<DataVersion> getVersion(String dataset, String scopeKey) {
        try {
            return currentVersion(dataset, scopeKey);
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("Relational store unavailable: " + e.getMessage(), e);
        }
    }

    private Optional<DataVersion> currentVersion(String dataset, String scopeKey) {
        List<DataVersion> versions = jdbcTemplate.query(SELECT_VERSION,
                (rs, i) -> new DataVersion(
                        rs.getString("version_id"),
                        rs.getString("dataset"),
                        rs.getString("scope_key"),
                        BackendKind.RELATIONAL,
                        rs.getTimestamp("created_at").toInstant(),
                        rs.getInt("record_count"),
                        rs.getString("source_tag"),
                        readMetadata(rs.getString("metadata"))),
                dataset, scopeKey);
        return versions.stream().findFirst();
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> readMetadata(String json) {
        return json == null ? Map.of() : codec.read(json, Map.class);
    }

    @Override
    public void validate() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("Relational store not reachable: " + e.getMessage(), e);
        }
    }

    private record ScopeMarker(String versionId, long revision) {
    }
}
