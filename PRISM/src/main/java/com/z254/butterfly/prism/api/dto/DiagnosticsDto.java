package com.z254.butterfly.prism.api.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class DiagnosticsDto {
    private Map<String, Integer> issueCounts;
    private Map<String, String> excludedVariables;
    private int testsPerformed;
    private int levelsCompleted;
    private boolean budgetExhausted;
    private List<Integer> edgesPerLevel;
}
