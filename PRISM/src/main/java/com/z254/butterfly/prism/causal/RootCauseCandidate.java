package com.z254.butterfly.prism.causal;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A variable with an estimated causal effect on the outcome of a discovery pass.
 */
@Value
@Builder
public class RootCauseCandidate {

    String variable;

    /** Average treatment effect: outcome change per unit change of the variable */
    double estimatedEffect;

    double standardError;

    /** In [0,1], 1 - p-value of the effect coefficient */
    double confidence;

    double pValue;

    double confidenceIntervalLower;

    double confidenceIntervalUpper;

    /** Variables from this candidate to the outcome, both ends included */
    @Singular("pathStep")
    List<String> pathToOutcome;

    /** Parents of the candidate the regression was adjusted for */
    @Singular("adjustedFor")
    List<String> adjustmentSet;

    int sampleSize;

    /** Null when refutation is disabled or could not be computed */
    PlaceboRefutation refutation;

    /**
     * Number of edges between the candidate and the outcome.
     */
    public int pathLength() {
        return Math.max(0, pathToOutcome.size() - 1);
    }
}
