package com.z254.butterfly.prism.kafka;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Discovery result as published to the diagnosis service: plain names, numbers and
 * edge directions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryResultMessage {

    private String passId;
    private String outcomeVariable;
    private long snapshotVersion;
    private int sampleSize;
    private List<Edge> edges;
    private List<RootCause> rootCauses;
    private Instant completedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Edge {
        private String from;
        private String to;
        private boolean directed;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RootCause {
        private int rank;
        private String variable;
        private double estimatedEffect;
        private double confidence;
        private List<String> pathToOutcome;
    }
}
