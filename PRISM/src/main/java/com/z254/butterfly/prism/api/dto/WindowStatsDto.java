package com.z254.butterfly.prism.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Current state of the observation window.
 */
@Data
@Builder
public class WindowStatsDto {
    private int size;
    private long version;
    private List<String> variables;
    private Instant oldestTimestamp;
    private Instant newestTimestamp;
    private int maxObservations;
    private String maxAge;
}
