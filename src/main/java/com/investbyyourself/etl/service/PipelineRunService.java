package com.investbyyourself.etl.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investbyyourself.etl.dto.RunResult;
import com.investbyyourself.etl.model.PipelineRun;
import com.investbyyourself.etl.model.RunStatus;
import com.investbyyourself.etl.repository.PipelineRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of pipeline runs. Runs in flight live in memory together with their
 * cancellation token; every state change is also written to {@code pipeline_runs} so
 * finished runs can be queried after a restart.
 */
@Service
public class PipelineRunService {

    private static final Logger logger = LoggerFactory.getLogger(PipelineRunService.class);

    private static final class ActiveRun {
        final CancellationToken token;
        volatile RunResult snapshot;

        ActiveRun(CancellationToken token, RunResult snapshot) {
            this.token = token;
            this.snapshot = snapshot;
        }
    }

    private final ConcurrentHashMap<UUID, ActiveRun> activeRuns = new ConcurrentHashMap<>();
    private final PipelineRunRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PipelineRunService(PipelineRunRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Registers a run under its id.
     *
     * @throws IllegalArgumentException when a run with the same id is active or recorded
     */
    public CancellationToken start(RunResult initial) {
        UUID runId = initial.runId();
        if (activeRuns.containsKey(runId) || recorded(runId)) {
            throw new IllegalArgumentException("Run id " + runId + " is already in use");
        }
        CancellationToken token = new CancellationToken();
        if (activeRuns.putIfAbsent(runId, new ActiveRun(token, initial)) != null) {
            throw new IllegalArgumentException("Run id " + runId + " is already in use");
        }
        persist(initial);
        logger.info("runId={} started dataset={} strategy={}", initial.runId(), initial.dataset(), initial.strategy());
        return token;
    }

    /**
     * Publishes an intermediate report for pollers; not persisted.
     */
    public void progress(RunResult snapshot) {
        ActiveRun run = activeRuns.get(snapshot.runId());
        if (run != null) {
            run.snapshot = snapshot;
        }
    }

    public void complete(RunResult result) {
        persist(result);
        activeRuns.remove(result.runId());
        logger.info("runId={} finished status={} errors={}", result.runId(), result.status(), result.errorCount());
    }

    /**
     * Latest snapshots of the runs in flight, oldest first.
     */
    public List<RunResult> activeRuns() {
        return activeRuns.values().stream()
                .map(run -> run.snapshot)
                .sorted(Comparator.comparing(RunResult::startedAt))
                .toList();
    }

    public Optional<RunResult> getRunStatus(UUID runId) {
        ActiveRun active = activeRuns.get(runId);
        if (active != null) {
            return Optional.of(active.snapshot);
        }
        return repository.findById(runId).map(this::toResult);
    }

    /**
     * Raises the cancellation token of a run in flight.
     *
     * @return false when the run already finished
     * @throws RunNotFoundException when the run is unknown
     */
    public boolean cancel(UUID runId) {
        ActiveRun active = activeRuns.get(runId);
        if (active != null) {
            logger.warn("runId={} cancellation requested", runId);
            active.token.cancel();
            return true;
        }
        if (repository.existsById(runId)) {
            return false;
        }
        throw new RunNotFoundException(runId);
    }

    /**
     * Runs still marked RUNNING at startup were cut off by a restart; they are closed as FAILED.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void failOrphanedRuns() {
        try {
            List<PipelineRun> orphaned = repository.findAllByStatus(RunStatus.RUNNING);
            OffsetDateTime now = OffsetDateTime.now(clock);
            for (PipelineRun run : orphaned) {
                if (activeRuns.containsKey(run.getId())) {
                    continue;
                }
                run.setStatus(RunStatus.FAILED);
                run.setFinishedAt(now);
                if (run.getDetail() != null) {
                    Map<String, Object> detail = new LinkedHashMap<>(run.getDetail());
                    detail.put("status", RunStatus.FAILED.name());
                    detail.put("finishedAt", now.toInstant().toString());
                    run.setDetail(detail);
                }
                repository.save(run);
                logger.warn("runId={} was still RUNNING at startup; marked FAILED", run.getId());
            }
        } catch (DataAccessException e) {
            logger.warn("Could not close orphaned runs: {}", e.getMessage());
        }
    }

    private boolean recorded(UUID runId) {
        try {
            return repository.existsById(runId);
        } catch (DataAccessException e) {
            logger.warn("runId={} could not check run history: {}", runId, e.getMessage());
            return false;
        }
    }

    private void persist(RunResult result) {
        try {
            PipelineRun run = repository.findById(result.runId()).orElseGet(PipelineRun::new);
            run.setId(result.runId());
            run.setStatus(result.status());
            run.setDataset(result.dataset());
            run.setStrategy(result.strategy());
            run.setRecordsCollected(result.collection().succeeded());
            run.setRecordsTransformed(result.transform().succeeded());
            run.setRecordsLoaded(result.load().succeeded());
            run.setRecordsFailed(result.errorCount());
            run.setDetail(objectMapper.convertValue(result, new TypeReference<Map<String, Object>>() {}));
            if (result.startedAt() != null) {
                run.setStartedAt(result.startedAt().atOffset(ZoneOffset.UTC));
            }
            if (result.finishedAt() != null) {
                run.setFinishedAt(result.finishedAt().atOffset(ZoneOffset.UTC));
            }
            repository.save(run);
        } catch (DataAccessException e) {
            logger.warn("runId={} could not persist run state {}: {}", result.runId(), result.status(), e.getMessage());
        }
    }

    private RunResult toResult(PipelineRun run) {
        if (run.getDetail() != null) {
            return objectMapper.convertValue(run.getDetail(), RunResult.class);
        }
        return new RunResult(run.getId(), run.getStatus() == null ? RunStatus.FAILED : run.getStatus(),
                run.getDataset(), run.getStrategy(),
                run.getStartedAt() == null ? null : run.getStartedAt().toInstant(),
                run.getFinishedAt() == null ? null : run.getFinishedAt().toInstant(),
                null, null, null, null, null, 0, null,
                run.getRecordsFailed() == null ? 0 : run.getRecordsFailed(), null);
    }
}
