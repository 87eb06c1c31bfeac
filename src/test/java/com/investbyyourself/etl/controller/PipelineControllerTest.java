package com.investbyyourself.etl.controller;

import com.investbyyourself.etl.dto.RunPipelineRequest;
import com.investbyyourself.etl.dto.RunResult;
import com.investbyyourself.etl.dto.VersionView;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.RunStatus;
import com.investbyyourself.etl.service.ConfigurationException;
import com.investbyyourself.etl.service.PipelineCoordinator;
import com.investbyyourself.etl.service.PipelineRunService;
import com.investbyyourself.etl.service.RunNotFoundException;
import com.investbyyourself.etl.service.VersionQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class PipelineControllerTest {

    private static final String RUN_BODY = """
            {"providers": ["yahoo"], "entityKeys": ["AAPL"], "from": "2024-01-01", "to": "2024-03-15"}
            """;

    @Mock
    private PipelineCoordinator coordinator;

    @Mock
    private PipelineRunService runService;

    @Mock
    private VersionQueryService versionQueryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new PipelineController(coordinator, runService, versionQueryService))
                .build();
    }

    private static RunResult result(UUID runId, RunStatus status) {
        return new RunResult(runId, status, "fundamentals", LoadingStrategy.UPSERT,
                Instant.parse("2024-03-15T18:00:00Z"), Instant.parse("2024-03-15T18:00:05Z"),
                null, null, null, null, null, 0, null, 1, null);
    }

    @Test
    void runReturnsReportEvenForPartialSuccess() throws Exception {
        UUID runId = UUID.randomUUID();
        when(coordinator.runPipeline(any(RunPipelineRequest.class))).thenReturn(result(runId, RunStatus.PARTIAL_SUCCESS));

        mockMvc.perform(post("/api/pipeline/runs").contentType(MediaType.APPLICATION_JSON).content(RUN_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value(runId.toString()))
                .andExpect(jsonPath("$.status").value("PARTIAL_SUCCESS"));
    }

    @Test
    void unknownProviderIsUnprocessable() throws Exception {
        when(coordinator.runPipeline(any(RunPipelineRequest.class)))
                .thenThrow(new ConfigurationException("Provider 'yahoo' is not configured or not enabled"));

        mockMvc.perform(post("/api/pipeline/runs").contentType(MediaType.APPLICATION_JSON).content(RUN_BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Provider 'yahoo' is not configured or not enabled"));
    }

    @Test
    void invertedWindowIsBadRequest() throws Exception {
        when(coordinator.runPipeline(any(RunPipelineRequest.class)))
                .thenThrow(new IllegalArgumentException("Time window start 2024-03-15 is after end 2024-01-01"));

        mockMvc.perform(post("/api/pipeline/runs").contentType(MediaType.APPLICATION_JSON).content(RUN_BODY))
                .andExpect(status().isBadRequest());
    }

    @Test
    void missingProvidersFailsValidation() throws Exception {
        mockMvc.perform(post("/api/pipeline/runs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entityKeys\": [\"AAPL\"]}"))
                .andExpect(status().isBadRequest());
        verify(coordinator, never()).runPipeline(any());
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.getRunStatus(runId)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/pipeline/runs/{runId}", runId))
                .andExpect(status().isNotFound());
    }

    @Test
    void knownRunIsReturned() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.getRunStatus(runId)).thenReturn(Optional.of(result(runId, RunStatus.SUCCESS)));

        mockMvc.perform(get("/api/pipeline/runs/{runId}", runId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.errorCount").value(1));
    }

    @Test
    void cancelOfActiveRunIsAccepted() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.cancel(runId)).thenReturn(true);

        mockMvc.perform(post("/api/pipeline/runs/{runId}/cancel", runId))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.cancelRequested").value(true));
    }

    @Test
    void cancelOfFinishedRunConflicts() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.cancel(runId)).thenReturn(false);

        mockMvc.perform(post("/api/pipeline/runs/{runId}/cancel", runId))
                .andExpect(status().isConflict());
    }

    @Test
    void cancelOfUnknownRunIsNotFound() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.cancel(runId)).thenThrow(new RunNotFoundException(runId));

        mockMvc.perform(post("/api/pipeline/runs/{runId}/cancel", runId))
                .andExpect(status().isNotFound());
    }

    @Test
    void versionsAreReturnedPerBackend() throws Exception {
        when(versionQueryService.versions("fundamentals", "AAPL"))
                .thenReturn(new VersionView("fundamentals", "AAPL", Map.of(), Map.of(), List.of()));

        mockMvc.perform(get("/api/versions").param("dataset", "fundamentals").param("scope", "AAPL"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scopeKey").value("AAPL"));
    }

    @Test
    void activeRunsAreListed() throws Exception {
        UUID runId = UUID.randomUUID();
        when(runService.activeRuns()).thenReturn(List.of(
                RunResult.running(runId, "fundamentals", LoadingStrategy.UPSERT, Instant.parse("2024-03-15T18:00:00Z"))));

        mockMvc.perform(get("/api/pipeline/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].runId").value(runId.toString()))
                .andExpect(jsonPath("$[0].status").value("RUNNING"));
    }

    @Test
    void runIdInUseIsBadRequest() throws Exception {
        UUID runId = UUID.randomUUID();
        when(coordinator.runPipeline(any(RunPipelineRequest.class)))
                .thenThrow(new IllegalArgumentException("Run id " + runId + " is already in use"));

        mockMvc.perform(post("/api/pipeline/runs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"runId\": \"" + runId + "\", \"providers\": [\"yahoo\"], \"entityKeys\": [\"AAPL\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Run id " + runId + " is already in use"));
    }
}
