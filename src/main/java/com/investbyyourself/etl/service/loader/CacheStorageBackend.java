package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.DataVersion;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.TransformedRecord;
import com.investbyyourself.etl.service.BackendUnavailableException;
import com.investbyyourself.etl.service.CancellationToken;
import com.investbyyourself.etl.service.ContentHashingService;
import com.investbyyourself.etl.service.RecordJsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Redis cache with TTL. Every change writes a full snapshot of the scope under a new
 * generation. Keys:
 * <ul>
 *     <li>{@code <prefix>:<dataset>:<scope>:g<gen>:<recordKey>} one record</li>
 *     <li>{@code <prefix>:index:<dataset>:<scope>:g<gen>} set of the generation's record keys</li>
 *     <li>{@code <prefix>:versions:<dataset>:<scope>} the scope's current {@link DataVersion},
 *     whose {@code generation} metadata points at the live snapshot</li>
 * </ul>
 * All keys share one TTL. The version key is the only pointer and is written after the
 * snapshot is complete, so a cancelled or failed load leaves the previous generation
 * current. A version whose rows are gone is dropped and the scope reloaded from scratch.
 */
public class CacheStorageBackend implements StorageBackend {

    private static final Logger logger = LoggerFactory.getLogger(CacheStorageBackend.class);

    static final String GENERATION = "generation";

    private final StringRedisTemplate redisTemplate;
    private final StrategyPlanner planner;
    private final ContentHashingService hashingService;
    private final RecordJsonCodec codec;
    private final String keyPrefix;
    private final Duration ttl;
    private final int batchSize;
    private final Clock clock;

    public CacheStorageBackend(StringRedisTemplate redisTemplate,
                               StrategyPlanner planner,
                               ContentHashingService hashingService,
                               RecordJsonCodec codec,
                               String keyPrefix,
                               Duration ttl,
                               int batchSize,
                               Clock clock) {
        this.redisTemplate = redisTemplate;
        this.planner = planner;
        this.hashingService = hashingService;
        this.codec = codec;
        this.keyPrefix = keyPrefix;
        this.ttl = ttl;
        this.batchSize = batchSize;
        this.clock = clock;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.CACHE;
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
        Instant started = clock.instant();
        try {
            Snapshot live = readSnapshot(dataset, scopeKey);
            WritePlan plan = planner.plan(live.state(), records, strategy);
            if (plan.unchanged()) {
                return ScopeLoadOutcome.from(scopeKey, records, plan, live.state().currentVersion(), false,
                        Duration.between(started, clock.instant()));
            }
            token.throwIfCancelled("cache load of scope " + scopeKey);

            String generation = String.valueOf(redisTemplate.opsForValue().increment(generationKey(dataset, scopeKey)));
            String index = indexKey(dataset, scopeKey, generation);
            Map<String, String> rows = snapshotRows(dataset, scopeKey, generation, plan);
            try {
                writeInBatches(index, rows, token, scopeKey);
                token.throwIfCancelled("cache load of scope " + scopeKey);
            } catch (RuntimeException e) {
                discard(index, rows.keySet(), scopeKey);
                throw e;
            }

            DataVersion previous = live.state().currentVersion();
            boolean created = previous == null || !plan.resultingVersionId().equals(previous.versionId());
            DataVersion version = created
                    ? newVersion(dataset, scopeKey, strategy, plan, rows.size(), generation, live.version())
                    : withGeneration(previous, generation);
            redisTemplate.opsForValue().set(versionKey(dataset, scopeKey), codec.toJson(version), ttl);

            if (live.generation() != null) {
                discard(indexKey(dataset, scopeKey, live.generation()), live.keys(), scopeKey);
            }
            logger.info("backend=CACHE dataset={} scope={} generation={} rows={} version={}",
                    dataset, scopeKey, generation, rows.size(), version.versionId());
            return ScopeLoadOutcome.from(scopeKey, records, plan, version, created,
                    Duration.between(started, clock.instant()));
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("Cache unavailable for scope " + scopeKey + ": " + e.getMessage(), e);
        }
    }

    private Map<String, String> snapshotRows(String dataset, String scopeKey, String generation, WritePlan plan) {
        Map<String, String> rows = new LinkedHashMap<>();
        Map<String, Integer> seen = new HashMap<>();
        for (WritePlan.PlannedRow row : plan.resultingRows()) {
            String key = recordKey(dataset, scopeKey, generation, row.record().recordKey());
            int occurrence = seen.merge(key, 1, Integer::sum);
            // appended duplicates of one record key
            if (occurrence > 1) {
                key = key + "#" + occurrence;
            }
            rows.put(key, codec.toJson(row.record()));
        }
        return rows;
    }

    private DataVersion newVersion(String dataset,
                                   String scopeKey,
                                   LoadingStrategy strategy,
                                   WritePlan plan,
                                   int recordCount,
                                   String generation,
                                   DataVersion previous) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("strategy", strategy.name());
        metadata.put("ttlSeconds", String.valueOf(ttl.toSeconds()));
        metadata.put(GENERATION, generation);
        if (previous != null) {
            metadata.put("previousVersionId", previous.versionId());
        }
        return new DataVersion(plan.resultingVersionId(), dataset, scopeKey, kind(), clock.instant(),
                recordCount, plan.sourceTag(), metadata);
    }

    private static DataVersion withGeneration(DataVersion version, String generation) {
        Map<String, String> metadata = new LinkedHashMap<>(version.metadata());
        metadata.put(GENERATION, generation);
        return new DataVersion(version.versionId(), version.dataset(), version.scopeKey(), version.backend(),
                version.createdAt(), version.recordCount(), version.sourceTag(), metadata);
    }

    private void writeInBatches(String index, Map<String, String> rows, CancellationToken token, String scopeKey) {
        List<Map.Entry<String, String>> entries = new ArrayList<>(rows.entrySet());
        for (int from = 0; from < entries.size(); from += batchSize) {
            token.throwIfCancelled("cache load of scope " + scopeKey);
            Map<String, String> chunk = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : entries.subList(from, Math.min(entries.size(), from + batchSize))) {
                chunk.put(entry.getKey(), entry.getValue());
            }
            redisTemplate.opsForValue().multiSet(chunk);
            for (String key : chunk.keySet()) {
                redisTemplate.expire(key, ttl);
            }
            redisTemplate.opsForSet().add(index, chunk.keySet().toArray(new String[0]));
            redisTemplate.expire(index, ttl);
        }
    }

    /**
     * Removes a generation that is not, or no longer, the live one. Leftovers expire with
     * their TTL, so a failure here is logged and not raised.
     */
    private void discard(String index, Collection<String> keys, String scopeKey) {
        try {
            List<String> doomed = new ArrayList<>(keys);
            doomed.add(index);
            redisTemplate.delete(doomed);
        } catch (DataAccessException e) {
            logger.warn("backend=CACHE scope={} could not remove generation {}: {}", scopeKey, index, e.getMessage());
        }
    }

    /**
     * Reads the live generation through the version key. A version whose index or rows
     * have expired no longer describes the cache and is removed.
     */
    private Snapshot readSnapshot(String dataset, String scopeKey) {
        DataVersion current = getVersion(dataset, scopeKey).orElse(null);
        if (current == null) {
            return new Snapshot(ScopeState.empty(), null, null, List.of());
        }
        String generation = current.metadata().get(GENERATION);
        if (generation == null) {
            return drifted(dataset, scopeKey, current, null, List.of(), 0);
        }
        Set<String> members = redisTemplate.opsForSet().members(indexKey(dataset, scopeKey, generation));
        List<String> keys = members == null ? List.of() : new ArrayList<>(new TreeSet<>(members));
        List<StoredRecord> rows = new ArrayList<>();
        if (!keys.isEmpty()) {
            List<String> values = redisTemplate.opsForValue().multiGet(keys);
            for (int i = 0; i < keys.size(); i++) {
                String json = values == null ? null : values.get(i);
                if (json != null) {
                    rows.add(new StoredRecord(keys.get(i), hashingService.hash(json), codec.readRecord(json)));
                }
            }
        }
        if (rows.size() != current.recordCount()) {
            return drifted(dataset, scopeKey, current, generation, keys, rows.size());
        }
        return new Snapshot(new ScopeState(rows, current), current, generation, keys);
    }

    private Snapshot drifted(String dataset,
                             String scopeKey,
                             DataVersion current,
                             String generation,
                             List<String> keys,
                             int found) {
        logger.warn("backend=CACHE dataset={} scope={} version={} expects {} rows but {} remain, dropping it",
                dataset, scopeKey, current.versionId(), current.recordCount(), found);
        redisTemplate.delete(versionKey(dataset, scopeKey));
        return new Snapshot(ScopeState.empty(), current, generation, keys);
    }

    @Override
    public Optional<DataVersion> getVersion(String dataset, String scopeKey) {
        try {
            String json = redisTemplate.opsForValue().get(versionKey(dataset, scopeKey));
            return json == null ? Optional.empty() : Optional.of(codec.readVersion(json));
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("Cache unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public void validate() {
        RedisConnectionFactory factory = redisTemplate.getConnectionFactory();
        if (factory == null) {
            throw new BackendUnavailableException("Cache has no connection factory");
        }
        try (RedisConnection connection = factory.getConnection()) {
            connection.ping();
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("Cache not reachable: " + e.getMessage(), e);
        }
    }

    String recordKey(String dataset, String scopeKey, String generation, String recordKey) {
        return keyPrefix + ":" + dataset + ":" + scopeKey + ":g" + generation + ":" + recordKey;
    }

    String indexKey(String dataset, String scopeKey, String generation) {
        return keyPrefix + ":index:" + dataset + ":" + scopeKey + ":g" + generation;
    }

    String versionKey(String dataset, String scopeKey) {
        return keyPrefix + ":versions:" + dataset + ":" + scopeKey;
    }

    private String generationKey(String dataset, String scopeKey) {
        return keyPrefix + ":gen:" + dataset + ":" + scopeKey;
    }

    /**
     * @param state      rows and version the planner works from; empty when the version drifted
     * @param version    version key as read, kept for the {@code previousVersionId} link
     * @param generation live generation to clean up after a successful flip
     * @param keys       record keys of that generation
     */
    private record Snapshot(ScopeState state, DataVersion version, String generation, List<String> keys) {
    }
}
