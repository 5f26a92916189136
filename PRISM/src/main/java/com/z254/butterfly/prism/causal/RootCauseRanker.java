package com.z254.butterfly.prism.causal;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Orders root-cause candidates, strongest first.
 */
@Component
public class RootCauseRanker {

    /**
     * Largest absolute effect first, then shortest path to the outcome, then highest
     * confidence, then variable name.
     */
    public static final Comparator<RootCauseCandidate> RANKING =
            Comparator.comparingDouble((RootCauseCandidate c) -> Math.abs(c.getEstimatedEffect())).reversed()
                    .thenComparingInt(RootCauseCandidate::pathLength)
                    .thenComparing(Comparator.comparingDouble(RootCauseCandidate::getConfidence).reversed())
                    .thenComparing(RootCauseCandidate::getVariable);

    public List<RootCauseCandidate> rank(Collection<RootCauseCandidate> candidates) {
        return rank(candidates, Integer.MAX_VALUE);
    }

    public List<RootCauseCandidate> rank(Collection<RootCauseCandidate> candidates, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        return candidates.stream()
                .sorted(RANKING)
                .limit(limit)
                .toList();
    }
}
