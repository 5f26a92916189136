package com.z254.butterfly.prism.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * DTO for a discovered causal graph.
 */
@Data
@Builder
public class CausalGraphDto {
    private String passId;
    private String outcomeVariable;
    private List<String> variables;
    private List<EdgeDto> edges;
    private Instant completedAt;
}
