package com.investbyyourself.etl.dto;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.ScopeGranularity;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Input of one pipeline run. Null strategy, backends, dataset and granularity fall back
 * to the configured defaults. A caller that wants to poll or cancel the run while it is
 * in flight supplies its own {@code runId}; otherwise one is generated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunPipelineRequest {

    private UUID runId;

    @NotEmpty
    private List<String> providers;

    @NotEmpty
    private List<String> entityKeys;

    private LocalDate from;
    private LocalDate to;
    private LoadingStrategy strategy;
    private Set<BackendKind> backends;
    private String dataset;
    private ScopeGranularity scopeGranularity;
    private boolean dropLowQuality;
}
