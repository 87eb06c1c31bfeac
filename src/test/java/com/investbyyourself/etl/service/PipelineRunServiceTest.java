package com.investbyyourself.etl.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.investbyyourself.etl.dto.RunResult;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.PipelineRun;
import com.investbyyourself.etl.model.RunStatus;
import com.investbyyourself.etl.repository.PipelineRunRepository;
import com.investbyyourself.etl.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineRunServiceTest {

    private static final Instant STARTED = Instant.parse("2024-03-15T18:00:00Z");

    @Mock
    private PipelineRunRepository repository;

    private PipelineRunService runService;

    @BeforeEach
    void setUp() {
        runService = new PipelineRunService(repository, new ObjectMapper().findAndRegisterModules(),
                new MutableClock(STARTED.plusSeconds(60)));
    }

    private static RunResult running(UUID runId) {
        return RunResult.running(runId, "fundamentals", LoadingStrategy.UPSERT, STARTED);
    }

    private static RunResult finished(UUID runId, RunStatus status) {
        return new RunResult(runId, status, "fundamentals", LoadingStrategy.UPSERT, STARTED,
                STARTED.plusSeconds(5), null, null, null, null, null, 0, null, 0, null);
    }

    @Test
    void activeRunIsServedFromMemoryWithLatestProgress() {
        UUID runId = UUID.randomUUID();
        runService.start(running(runId));
        RunResult progress = finished(runId, RunStatus.RUNNING);
        runService.progress(progress);

        assertThat(runService.getRunStatus(runId)).contains(progress);
        ArgumentCaptor<PipelineRun> saved = ArgumentCaptor.forClass(PipelineRun.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(saved.getValue().getDetail()).containsEntry("dataset", "fundamentals");
    }

    @Test
    void cancelRaisesTokenOfActiveRun() {
        UUID runId = UUID.randomUUID();
        CancellationToken token = runService.start(running(runId));

        assertThat(runService.cancel(runId)).isTrue();
        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    void finishedRunCannotBeCancelled() {
        UUID runId = UUID.randomUUID();
        runService.start(running(runId));
        runService.complete(finished(runId, RunStatus.SUCCESS));
        when(repository.existsById(runId)).thenReturn(true);

        assertThat(runService.cancel(runId)).isFalse();
        verify(repository, times(2)).save(any());
    }

    @Test
    void unknownRunCannotBeCancelled() {
        UUID runId = UUID.randomUUID();
        when(repository.existsById(runId)).thenReturn(false);

        assertThatThrownBy(() -> runService.cancel(runId)).isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void finishedRunIsReadBackFromRepository() {
        UUID runId = UUID.randomUUID();
        PipelineRun row = PipelineRun.builder()
                .id(runId)
                .status(RunStatus.PARTIAL_SUCCESS)
                .dataset("fundamentals")
                .strategy(LoadingStrategy.APPEND)
                .recordsFailed(3)
                .startedAt(OffsetDateTime.parse("2024-03-15T18:00:00Z"))
                .build();
        when(repository.findById(runId)).thenReturn(Optional.of(row));

        Optional<RunResult> result = runService.getRunStatus(runId);

        assertThat(result).hasValueSatisfying(r -> {
            assertThat(r.status()).isEqualTo(RunStatus.PARTIAL_SUCCESS);
            assertThat(r.strategy()).isEqualTo(LoadingStrategy.APPEND);
            assertThat(r.errorCount()).isEqualTo(3);
            assertThat(r.startedAt()).isEqualTo(STARTED);
        });
    }

    @Test
    void repositoryOutageDoesNotStopTheRun() {
        UUID runId = UUID.randomUUID();
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        CancellationToken token = runService.start(running(runId));

        assertThat(token.isCancelled()).isFalse();
        assertThat(runService.getRunStatus(runId)).isPresent();
    }

    @Test
    void runsLeftRunningByRestartAreClosedAsFailed() {
        UUID runId = UUID.randomUUID();
        Map<String, Object> detail = new HashMap<>();
        detail.put("status", "RUNNING");
        PipelineRun orphan = PipelineRun.builder()
                .id(runId)
                .status(RunStatus.RUNNING)
                .dataset("fundamentals")
                .strategy(LoadingStrategy.UPSERT)
                .detail(detail)
                .startedAt(OffsetDateTime.parse("2024-03-15T18:00:00Z"))
                .build();
        when(repository.findAllByStatus(RunStatus.RUNNING)).thenReturn(List.of(orphan));

        runService.failOrphanedRuns();

        ArgumentCaptor<PipelineRun> saved = ArgumentCaptor.forClass(PipelineRun.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(saved.getValue().getFinishedAt()).isEqualTo(OffsetDateTime.parse("2024-03-15T18:01:00Z"));
        assertThat(saved.getValue().getDetail()).containsEntry("status", "FAILED");
    }

    @Test
    void runIdAlreadyActiveIsRejected() {
        UUID runId = UUID.randomUUID();
        CancellationToken token = runService.start(running(runId));

        assertThatThrownBy(() -> runService.start(running(runId)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(runId.toString());
        assertThat(token.isCancelled()).isFalse();
        assertThat(runService.activeRuns()).hasSize(1);
    }

    @Test
    void runIdFromHistoryIsRejected() {
        UUID runId = UUID.randomUUID();
        when(repository.existsById(runId)).thenReturn(true);

        assertThatThrownBy(() -> runService.start(running(runId)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(runService.activeRuns()).isEmpty();
    }

    @Test
    void activeRunsListsInFlightRunsOldestFirst() {
        UUID older = UUID.randomUUID();
        UUID newer = UUID.randomUUID();
        UUID done = UUID.randomUUID();
        runService.start(RunResult.running(newer, "fundamentals", LoadingStrategy.UPSERT, STARTED.plusSeconds(10)));
        runService.start(running(older));
        runService.start(running(done));
        runService.complete(finished(done, RunStatus.SUCCESS));

        assertThat(runService.activeRuns()).extracting(RunResult::runId).containsExactly(older, newer);
    }
}
