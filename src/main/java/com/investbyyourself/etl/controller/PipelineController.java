package com.investbyyourself.etl.controller;

import com.investbyyourself.etl.dto.RunPipelineRequest;
import com.investbyyourself.etl.dto.RunResult;
import com.investbyyourself.etl.dto.VersionView;
import com.investbyyourself.etl.service.ConfigurationException;
import com.investbyyourself.etl.service.PipelineCoordinator;
import com.investbyyourself.etl.service.PipelineRunService;
import com.investbyyourself.etl.service.RunNotFoundException;
import com.investbyyourself.etl.service.VersionQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@Tag(name = "Pipeline", description = "Run the collect-transform-load pipeline and inspect runs and data versions")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineCoordinator coordinator;
    private final PipelineRunService runService;
    private final VersionQueryService versionQueryService;

    public PipelineController(PipelineCoordinator coordinator,
                              PipelineRunService runService,
                              VersionQueryService versionQueryService) {
        this.coordinator = coordinator;
        this.runService = runService;
        this.versionQueryService = versionQueryService;
    }

    /**
     * Runs the pipeline synchronously and returns its report. Partial failures are part
     * of a 200 response; only an unusable request is rejected.
     */
    @Operation(
            summary = "Run the pipeline",
            description = "Collects from the given providers, transforms and loads into the requested backends."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Run finished; see status for the outcome"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "422", description = "Unknown provider or unusable configuration"),
            @ApiResponse(responseCode = "500", description = "Unexpected server error")
    })
    @PostMapping("/pipeline/runs")
    public ResponseEntity<?> runPipeline(@Valid @RequestBody RunPipelineRequest request) {
        try {
            return ResponseEntity.ok(coordinator.runPipeline(request));
        } catch (ConfigurationException e) {
            logger.warn("Rejected pipeline request: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error(e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Pipeline run failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "List active runs", description = "Latest report of every run still in flight.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Active runs returned")
    })
    @GetMapping("/pipeline/runs")
    public ResponseEntity<List<RunResult>> listActiveRuns() {
        return ResponseEntity.ok(runService.activeRuns());
    }

    @Operation(summary = "Get run status", description = "Returns the live or final report of a run.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Run found"),
            @ApiResponse(responseCode = "404", description = "Unknown run id")
    })
    @GetMapping("/pipeline/runs/{runId}")
    public ResponseEntity<?> getRunStatus(
            @Parameter(description = "Run ID", required = true) @PathVariable UUID runId) {
        Optional<RunResult> result = runService.getRunStatus(runId);
        if (result.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("Run " + runId + " not found"));
        }
        return ResponseEntity.ok(result.get());
    }

    @Operation(summary = "Cancel a run", description = "Requests cooperative cancellation of an active run.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Cancellation requested"),
            @ApiResponse(responseCode = "404", description = "Unknown run id"),
            @ApiResponse(responseCode = "409", description = "Run already finished")
    })
    @PostMapping("/pipeline/runs/{runId}/cancel")
    public ResponseEntity<?> cancelRun(
            @Parameter(description = "Run ID", required = true) @PathVariable UUID runId) {
        try {
            if (runService.cancel(runId)) {
                return ResponseEntity.accepted().body(Map.of("runId", runId, "cancelRequested", true));
            }
            return ResponseEntity.status(HttpStatus.CONFLICT).body(error("Run " + runId + " already finished"));
        } catch (RunNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "Get data versions", description = "Current version per backend plus the audited history.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Versions returned"),
            @ApiResponse(responseCode = "400", description = "Missing dataset or scope")
    })
    @GetMapping("/versions")
    public ResponseEntity<?> getVersions(@RequestParam String dataset, @RequestParam String scope) {
        try {
            VersionView view = versionQueryService.versions(dataset, scope);
            return ResponseEntity.ok(view);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        }
    }

    private static Map<String, String> error(String message) {
        return Map.of("error", message == null ? "unknown error" : message);
    }
}
