package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.service.BackendUnavailableException;
import com.investbyyourself.etl.service.CancellationToken;
import com.investbyyourself.etl.service.ContentHashingService;
import com.investbyyourself.etl.service.RecordJsonCodec;
import com.investbyyourself.etl.service.RunCancelledException;
import com.investbyyourself.etl.service.VersionConflictException;
import com.investbyyourself.etl.support.MutableClock;
import com.investbyyourself.etl.support.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RelationalStorageBackendTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private TransactionTemplate transactionTemplate;

    private final RecordJsonCodec codec = new RecordJsonCodec();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-15T18:00:00Z"));
    private RelationalStorageBackend backend;

    @BeforeEach
    void setUp() {
        backend = new RelationalStorageBackend(jdbcTemplate, transactionTemplate,
                new StrategyPlanner(new ContentHashingService(codec)), codec, 2, clock);
    }

    private void runCallbacksInline() {
        when(transactionTemplate.execute(any())).thenAnswer(inv ->
                ((TransactionCallback<?>) inv.getArgument(0)).doInTransaction(null));
    }

    @SuppressWarnings("unchecked")
    private void stubEmptyScope() {
        when(jdbcTemplate.query(eq(RelationalStorageBackend.SELECT_SCOPE), any(RowMapper.class), eq("fundamentals"),
                eq("AAPL"))).thenReturn(List.of());
        when(jdbcTemplate.query(eq(RelationalStorageBackend.SELECT_ROWS), any(RowMapper.class), eq("fundamentals"),
                eq("AAPL"))).thenReturn(List.of());
    }

    @Test
    @SuppressWarnings("unchecked")
    void firstLoadInsertsRowsScopeMarkerAndVersionInOneTransaction() {
        runCallbacksInline();
        stubEmptyScope();

        ScopeLoadOutcome outcome = backend.loadScope("fundamentals", "AAPL", TestRecords.series("AAPL", 3),
                LoadingStrategy.UPSERT, CancellationToken.none());

        ArgumentCaptor<List<Object[]>> batches = ArgumentCaptor.forClass(List.class);
        verify(jdbcTemplate, times(2))
                .batchUpdate(eq(RelationalStorageBackend.INSERT_ROW), batches.capture());
        assertThat(batches.getAllValues()).extracting(List::size).containsExactly(2, 1);
        verify(jdbcTemplate).update(eq(RelationalStorageBackend.INSERT_SCOPE), eq("fundamentals"), eq("AAPL"),
                eq(outcome.version().versionId()), any());
        verify(jdbcTemplate).update(eq(RelationalStorageBackend.INSERT_VERSION), any(), eq(outcome.version().versionId()),
                eq("fundamentals"), eq("AAPL"), eq(3), eq("yahoo"), anyString(), any());
        assertThat(outcome.versionCreated()).isTrue();
        assertThat(outcome.version().backend()).isEqualTo(BackendKind.RELATIONAL);
        assertThat(outcome.metrics().inserted()).isEqualTo(3);
    }

    @Test
    @SuppressWarnings("unchecked")
    void concurrentRevisionChangeIsVersionConflict() throws Exception {
        runCallbacksInline();
        ResultSet marker = mock(ResultSet.class);
        when(marker.getString("version_id")).thenReturn("old");
        when(marker.getLong("revision")).thenReturn(3L);
        when(jdbcTemplate.query(eq(RelationalStorageBackend.SELECT_SCOPE), any(RowMapper.class), eq("fundamentals"),
                eq("AAPL"))).thenAnswer(inv -> List.of(((RowMapper<?>) inv.getArgument(1)).mapRow(marker, 0)));
        when(jdbcTemplate.query(eq(RelationalStorageBackend.SELECT_VERSION), any(RowMapper.class), eq("fundamentals"),
                eq("AAPL"))).thenReturn(List.of());
        when(jdbcTemplate.query(eq(RelationalStorageBackend.SELECT_ROWS), any(RowMapper.class), eq("fundamentals"),
                eq("AAPL"))).thenReturn(List.of());
        when(jdbcTemplate.update(eq(RelationalStorageBackend.UPDATE_SCOPE), any(), any(), eq("fundamentals"), eq("AAPL"),
                eq(3L))).thenReturn(0);

        assertThatThrownBy(() -> backend.loadScope("fundamentals", "AAPL", TestRecords.series("AAPL", 1),
                LoadingStrategy.UPSERT, CancellationToken.none()))
                .isInstanceOf(VersionConflictException.class);
    }

    @Test
    void cancelledTokenAbortsBeforeAnyWrite() {
        runCallbacksInline();
        stubEmptyScope();
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> backend.loadScope("fundamentals", "AAPL", TestRecords.series("AAPL", 3),
                LoadingStrategy.UPSERT, token))
                .isInstanceOf(RunCancelledException.class);
        verify(jdbcTemplate, never()).batchUpdate(anyString(), anyList());
    }

    @Test
    void connectionFailureIsBackendUnavailable() {
        when(transactionTemplate.execute(any())).thenThrow(new CannotGetJdbcConnectionException("down"));

        assertThatThrownBy(() -> backend.loadScope("fundamentals", "AAPL", TestRecords.series("AAPL", 1),
                LoadingStrategy.UPSERT, CancellationToken.none()))
                .isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void validateFailsWhenDatabaseUnreachable() {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class))
                .thenThrow(new CannotGetJdbcConnectionException("down"));

        assertThatThrownBy(() -> backend.validate()).isInstanceOf(BackendUnavailableException.class);
    }
}
