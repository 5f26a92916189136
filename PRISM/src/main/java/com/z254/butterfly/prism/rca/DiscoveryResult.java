package com.z254.butterfly.prism.rca;

import com.z254.butterfly.prism.causal.CausalGraph;
import com.z254.butterfly.prism.causal.DiscoveryDiagnostics;
import com.z254.butterfly.prism.causal.RootCauseCandidate;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Graph and ranked root causes produced by one discovery pass.
 */
@Value
@Builder
public class DiscoveryResult {

    String passId;

    String outcomeVariable;

    /** Version of the observation window the pass ran on */
    long snapshotVersion;

    int sampleSize;

    double significanceThreshold;

    int maxConditioningSize;

    CausalGraph graph;

    /** Highest ranked first */
    List<RootCauseCandidate> candidates;

    DiscoveryDiagnostics diagnostics;

    Instant startedAt;

    Instant completedAt;

    public Optional<RootCauseCandidate> topCandidate() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }
}
