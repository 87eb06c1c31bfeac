package com.investbyyourself.etl.service;

import com.investbyyourself.etl.config.EtlProperties;
import com.investbyyourself.etl.dto.RunPipelineRequest;
import com.investbyyourself.etl.dto.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the configured pipeline on the {@code etl.schedule.cron} schedule.
 */
@Service
@ConditionalOnProperty(prefix = "etl.schedule", name = "enabled", havingValue = "true")
public class ScheduledPipelineJob {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledPipelineJob.class);

    private final PipelineCoordinator coordinator;
    private final EtlProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ScheduledPipelineJob(PipelineCoordinator coordinator, EtlProperties properties) {
        this.coordinator = coordinator;
        this.properties = properties;
    }

    @Scheduled(cron = "${etl.schedule.cron:0 0 6 * * MON-FRI}")
    public void runScheduled() {
        if (!running.compareAndSet(false, true)) {
            logger.warn("Scheduled pipeline still running; skipping tick.");
            return;
        }
        try {
            RunResult result = coordinator.runPipeline(request());
            logger.info("Scheduled run finished runId={} status={} loaded={} errors={}",
                    result.runId(), result.status(), result.load().succeeded(), result.errorCount());
        } catch (EtlException | IllegalArgumentException e) {
            logger.error("Scheduled run rejected: {}", e.getMessage());
        } finally {
            running.set(false);
        }
    }

    RunPipelineRequest request() {
        EtlProperties.Schedule schedule = properties.getSchedule();
        return RunPipelineRequest.builder()
                .providers(new ArrayList<>(schedule.getProviders()))
                .entityKeys(new ArrayList<>(schedule.getEntityKeys()))
                .dataset(schedule.getDataset())
                .strategy(schedule.getStrategy())
                .backends(schedule.getBackends().isEmpty() ? null : EnumSet.copyOf(schedule.getBackends()))
                .build();
    }
}
