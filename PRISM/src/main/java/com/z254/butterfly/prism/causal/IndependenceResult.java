package com.z254.butterfly.prism.causal;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one conditional-independence test.
 */
@Value
@Builder
public class IndependenceResult {

    public enum Status {
        /** Test computed; {@code independent} reflects the p-value */
        DECIDED,
        /** Too few complete rows for the conditioning set */
        INSUFFICIENT_DATA,
        /** Ill-conditioned conditioning set or zero-variance column */
        NUMERIC_INSTABILITY
    }

    Status status;
    boolean independent;
    double pValue;
    double statistic;
    double partialCorrelation;
    int sampleSize;

    public boolean isDecided() {
        return status == Status.DECIDED;
    }

    /**
     * The issue to record for an undecided test, or {@code null} when decided.
     */
    public DiscoveryIssue issue() {
        return switch (status) {
            case DECIDED -> null;
            case INSUFFICIENT_DATA -> DiscoveryIssue.INSUFFICIENT_DATA;
            case NUMERIC_INSTABILITY -> DiscoveryIssue.NUMERIC_INSTABILITY;
        };
    }

    static IndependenceResult undecided(Status status, int sampleSize) {
        return IndependenceResult.builder()
                .status(status)
                .independent(false)
                .pValue(Double.NaN)
                .statistic(Double.NaN)
                .partialCorrelation(Double.NaN)
                .sampleSize(sampleSize)
                .build();
    }
}
