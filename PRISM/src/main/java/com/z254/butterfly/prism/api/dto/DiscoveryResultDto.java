package com.z254.butterfly.prism.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * DTO for a discovery pass in API responses.
 */
@Data
@Builder
public class DiscoveryResultDto {
    private String passId;
    private String outcomeVariable;
    private long snapshotVersion;
    private int sampleSize;
    private double significanceThreshold;
    private int maxConditioningSize;
    private CausalGraphDto graph;
    private List<RootCauseDto> rootCauses;
    private DiagnosticsDto diagnostics;
    private Instant startedAt;
    private Instant completedAt;
    private long durationMs;
}
