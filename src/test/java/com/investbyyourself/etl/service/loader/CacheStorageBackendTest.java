package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.DataVersion;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.TransformedRecord;
import com.investbyyourself.etl.service.BackendUnavailableException;
import com.investbyyourself.etl.service.CancellationToken;
import com.investbyyourself.etl.service.ContentHashingService;
import com.investbyyourself.etl.service.RecordJsonCodec;
import com.investbyyourself.etl.service.RunCancelledException;
import com.investbyyourself.etl.support.MutableClock;
import com.investbyyourself.etl.support.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CacheStorageBackendTest {

    private static final String VERSION_KEY = "ibys:versions:fundamentals:AAPL";
    private static final String GENERATION_KEY = "ibys:gen:fundamentals:AAPL";
    private static final Duration TTL = Duration.ofHours(1);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private SetOperations<String, String> setOperations;

    private final RecordJsonCodec codec = new RecordJsonCodec();
    private final ContentHashingService hashingService = new ContentHashingService(codec);
    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-15T18:00:00Z"));
    private CacheStorageBackend backend;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        lenient().when(redisTemplate.opsForSet()).thenReturn(setOperations);
        backend = new CacheStorageBackend(redisTemplate, new StrategyPlanner(hashingService), hashingService, codec,
                "ibys", TTL, 2, clock);
    }

    /**
     * Stubs generation 1 of AAPL as live with the given records and returns its version.
     */
    private DataVersion liveGeneration(List<TransformedRecord> stored, Set<String> indexMembers) {
        List<String> jsons = stored.stream().map(codec::toJson).toList();
        String versionId = hashingService.versionId(jsons.stream().map(hashingService::hash).toList());
        DataVersion current = new DataVersion(versionId, "fundamentals", "AAPL", BackendKind.CACHE,
                Instant.parse("2024-03-14T18:00:00Z"), stored.size(), "yahoo",
                Map.of(CacheStorageBackend.GENERATION, "1"));
        when(valueOperations.get(VERSION_KEY)).thenReturn(codec.toJson(current));
        when(setOperations.members(backend.indexKey("fundamentals", "AAPL", "1"))).thenReturn(indexMembers);
        return current;
    }

    private Set<String> membersOf(List<TransformedRecord> records, String generation) {
        Set<String> members = new LinkedHashSet<>();
        for (TransformedRecord record : records) {
            members.add(backend.recordKey("fundamentals", "AAPL", generation, record.recordKey()));
        }
        return members;
    }

    @Test
    @SuppressWarnings("unchecked")
    void writesSnapshotInBatchesAndPublishesVersionLast() {
        when(valueOperations.get(VERSION_KEY)).thenReturn(null);
        when(valueOperations.increment(GENERATION_KEY)).thenReturn(1L);

        ScopeLoadOutcome outcome = backend.loadScope("fundamentals", "AAPL", TestRecords.series("AAPL", 3),
                LoadingStrategy.UPSERT, CancellationToken.none());

        ArgumentCaptor<Map<String, String>> batches = ArgumentCaptor.forClass(Map.class);
        InOrder order = inOrder(valueOperations);
        order.verify(valueOperations, times(2)).multiSet(batches.capture());
        order.verify(valueOperations).set(eq(VERSION_KEY), anyString(), eq(TTL));
        assertThat(batches.getAllValues()).extracting(Map::size).containsExactly(2, 1);
        assertThat(batches.getAllValues().get(0)).containsKey("ibys:fundamentals:AAPL:g1:AAPL@2024-03-15");
        verify(redisTemplate).expire("ibys:fundamentals:AAPL:g1:AAPL@2024-03-15", TTL);
        assertThat(outcome.versionCreated()).isTrue();
        assertThat(outcome.version().backend()).isEqualTo(BackendKind.CACHE);
        assertThat(outcome.version().recordCount()).isEqualTo(3);
        assertThat(outcome.version().metadata()).containsEntry(CacheStorageBackend.GENERATION, "1");
    }

    @Test
    void unchangedIncrementalLoadWritesNothing() {
        List<TransformedRecord> batch = TestRecords.series("AAPL", 2);
        DataVersion current = liveGeneration(batch, membersOf(batch, "1"));
        // members are read back in sorted order: 2024-03-14 before 2024-03-15
        when(valueOperations.multiGet(any())).thenReturn(List.of(codec.toJson(batch.get(1)), codec.toJson(batch.get(0))));

        ScopeLoadOutcome outcome = backend.loadScope("fundamentals", "AAPL", batch, LoadingStrategy.INCREMENTAL,
                CancellationToken.none());

        assertThat(outcome.versionCreated()).isFalse();
        assertThat(outcome.metrics().writes()).isZero();
        assertThat(outcome.version()).isEqualTo(current);
        verify(valueOperations, never()).multiSet(anyMap());
        verify(valueOperations, never()).increment(anyString());
    }

    @Test
    void versionWhoseRowsExpiredIsDroppedAndScopeRewritten() {
        List<TransformedRecord> batch = TestRecords.series("AAPL", 2);
        DataVersion stale = liveGeneration(batch, Set.of());
        when(valueOperations.increment(GENERATION_KEY)).thenReturn(2L);

        ScopeLoadOutcome outcome = backend.loadScope("fundamentals", "AAPL", batch, LoadingStrategy.INCREMENTAL,
                CancellationToken.none());

        verify(redisTemplate).delete(VERSION_KEY);
        verify(valueOperations).multiSet(anyMap());
        verify(valueOperations).set(eq(VERSION_KEY), anyString(), eq(TTL));
        assertThat(outcome.metrics().inserted()).isEqualTo(2);
        assertThat(outcome.metrics().skipped()).isZero();
        assertThat(outcome.versionCreated()).isTrue();
        assertThat(outcome.version().versionId()).isEqualTo(stale.versionId());
        assertThat(outcome.version().metadata())
                .containsEntry(CacheStorageBackend.GENERATION, "2")
                .containsEntry("previousVersionId", stale.versionId());
    }

    @Test
    @SuppressWarnings("unchecked")
    void replaceFlipsVersionBeforeRemovingPreviousGeneration() {
        List<TransformedRecord> old = List.of(TestRecords.record("AAPL", "180"));
        liveGeneration(old, membersOf(old, "1"));
        when(valueOperations.multiGet(any())).thenReturn(List.of(codec.toJson(old.get(0))));
        when(valueOperations.increment(GENERATION_KEY)).thenReturn(2L);

        ScopeLoadOutcome outcome = backend.loadScope("fundamentals", "AAPL",
                List.of(TestRecords.record("AAPL", "200")), LoadingStrategy.REPLACE, CancellationToken.none());

        ArgumentCaptor<Collection<String>> deleted = ArgumentCaptor.forClass(Collection.class);
        InOrder order = inOrder(valueOperations, redisTemplate);
        order.verify(valueOperations).set(eq(VERSION_KEY), anyString(), eq(TTL));
        order.verify(redisTemplate).delete(deleted.capture());
        assertThat(deleted.getValue()).containsExactlyInAnyOrder(
                "ibys:fundamentals:AAPL:g1:AAPL@2024-03-15", "ibys:index:fundamentals:AAPL:g1");
        assertThat(outcome.metrics().deleted()).isEqualTo(1);
        assertThat(outcome.metrics().inserted()).isEqualTo(1);
        assertThat(outcome.versionCreated()).isTrue();
    }

    @Test
    @SuppressWarnings("unchecked")
    void replaceCancelledWhileStagingKeepsPreviousGenerationLive() {
        List<TransformedRecord> old = List.of(TestRecords.record("AAPL", "180"));
        liveGeneration(old, membersOf(old, "1"));
        when(valueOperations.multiGet(any())).thenReturn(List.of(codec.toJson(old.get(0))));
        when(valueOperations.increment(GENERATION_KEY)).thenReturn(2L);
        CancellationToken token = new CancellationToken();
        doAnswer(invocation -> {
            token.cancel();
            return null;
        }).when(valueOperations).multiSet(anyMap());

        assertThatThrownBy(() -> backend.loadScope("fundamentals", "AAPL",
                List.of(TestRecords.record("AAPL", "200")), LoadingStrategy.REPLACE, token))
                .isInstanceOf(RunCancelledException.class);

        verify(valueOperations, never()).set(eq(VERSION_KEY), anyString(), any(Duration.class));
        ArgumentCaptor<Collection<String>> deleted = ArgumentCaptor.forClass(Collection.class);
        verify(redisTemplate).delete(deleted.capture());
        assertThat(deleted.getValue()).containsExactlyInAnyOrder(
                "ibys:fundamentals:AAPL:g2:AAPL@2024-03-15", "ibys:index:fundamentals:AAPL:g2");
        verify(redisTemplate, never()).delete(VERSION_KEY);
    }

    @Test
    void appendedDuplicatesGetDistinctKeys() {
        when(valueOperations.get(VERSION_KEY)).thenReturn(null);
        when(valueOperations.increment(GENERATION_KEY)).thenReturn(1L);

        backend.loadScope("fundamentals", "AAPL",
                List.of(TestRecords.record("AAPL", "180"), TestRecords.record("AAPL", "181")),
                LoadingStrategy.APPEND, CancellationToken.none());

        verify(setOperations).add("ibys:index:fundamentals:AAPL:g1",
                "ibys:fundamentals:AAPL:g1:AAPL@2024-03-15", "ibys:fundamentals:AAPL:g1:AAPL@2024-03-15#2");
    }

    @Test
    void connectionFailureIsBackendUnavailable() {
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> backend.loadScope("fundamentals", "AAPL", TestRecords.series("AAPL", 1),
                LoadingStrategy.UPSERT, CancellationToken.none()))
                .isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void readsCurrentVersion() {
        DataVersion version = new DataVersion("abc", "fundamentals", "MSFT", BackendKind.CACHE,
                Instant.parse("2024-03-14T18:00:00Z"), 4, "yahoo", Map.of("strategy", "UPSERT"));
        when(valueOperations.get("ibys:versions:fundamentals:MSFT")).thenReturn(codec.toJson(version));

        assertThat(backend.getVersion("fundamentals", "MSFT")).contains(version);
    }
}
