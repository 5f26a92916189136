package com.z254.butterfly.prism.api.mapper;

import com.z254.butterfly.prism.api.dto.*;
import com.z254.butterfly.prism.causal.CausalEdge;
import com.z254.butterfly.prism.causal.DiscoveryDiagnostics;
import com.z254.butterfly.prism.causal.PlaceboRefutation;
import com.z254.butterfly.prism.causal.RootCauseCandidate;
import com.z254.butterfly.prism.rca.DiscoveryResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapper for discovery results to DTO conversion.
 */
public final class DiscoveryMapper {

    private DiscoveryMapper() {}

    public static DiscoveryResultDto toDto(DiscoveryResult result) {
        List<RootCauseDto> rootCauses = new ArrayList<>();
        int rank = 1;
        for (RootCauseCandidate candidate : result.getCandidates()) {
            rootCauses.add(toDto(candidate, rank++));
        }

        return DiscoveryResultDto.builder()
                .passId(result.getPassId())
                .outcomeVariable(result.getOutcomeVariable())
                .snapshotVersion(result.getSnapshotVersion())
                .sampleSize(result.getSampleSize())
                .significanceThreshold(result.getSignificanceThreshold())
                .maxConditioningSize(result.getMaxConditioningSize())
                .graph(toGraphDto(result))
                .rootCauses(rootCauses)
                .diagnostics(toDto(result.getDiagnostics()))
                .startedAt(result.getStartedAt())
                .completedAt(result.getCompletedAt())
                .durationMs(Duration.between(result.getStartedAt(), result.getCompletedAt()).toMillis())
                .build();
    }

    public static CausalGraphDto toGraphDto(DiscoveryResult result) {
        return CausalGraphDto.builder()
                .passId(result.getPassId())
                .outcomeVariable(result.getOutcomeVariable())
                .variables(result.getGraph().getVariables())
                .edges(result.getGraph().getEdges().stream().map(DiscoveryMapper::toDto).toList())
                .completedAt(result.getCompletedAt())
                .build();
    }

    public static EdgeDto toDto(CausalEdge edge) {
        return EdgeDto.builder()
                .from(edge.isDirected() ? edge.source() : edge.first())
                .to(edge.isDirected() ? edge.target() : edge.second())
                .direction(edge.isDirected() ? "DIRECTED" : "UNDETERMINED")
                .directed(edge.isDirected())
                .build();
    }

    public static RootCauseDto toDto(RootCauseCandidate candidate, int rank) {
        PlaceboRefutation refutation = candidate.getRefutation();
        return RootCauseDto.builder()
                .rank(rank)
                .variable(candidate.getVariable())
                .estimatedEffect(candidate.getEstimatedEffect())
                .standardError(candidate.getStandardError())
                .confidence(candidate.getConfidence())
                .pValue(candidate.getPValue())
                .confidenceIntervalLower(candidate.getConfidenceIntervalLower())
                .confidenceIntervalUpper(candidate.getConfidenceIntervalUpper())
                .pathToOutcome(candidate.getPathToOutcome())
                .adjustmentSet(candidate.getAdjustmentSet())
                .sampleSize(candidate.getSampleSize())
                .placeboEffect(refutation != null ? refutation.getPlaceboEffect() : null)
                .placeboPValue(refutation != null ? refutation.getPlaceboPValue() : null)
                .refutationPassed(refutation != null ? refutation.isPassed() : null)
                .build();
    }

    public static DiagnosticsDto toDto(DiscoveryDiagnostics diagnostics) {
        Map<String, Integer> issues = new LinkedHashMap<>();
        diagnostics.getIssueCounts().forEach((issue, count) -> issues.put(issue.name(), count));
        Map<String, String> excluded = new LinkedHashMap<>();
        diagnostics.getExcludedVariables().forEach((variable, issue) -> excluded.put(variable, issue.name()));

        return DiagnosticsDto.builder()
                .issueCounts(issues)
                .excludedVariables(excluded)
                .testsPerformed(diagnostics.getTestsPerformed())
                .levelsCompleted(diagnostics.getLevelsCompleted())
                .budgetExhausted(diagnostics.isBudgetExhausted())
                .edgesPerLevel(diagnostics.getEdgesPerLevel())
                .build();
    }
}
