package com.z254.butterfly.prism.api.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * DTO for a ranked root-cause candidate.
 */
@Data
@Builder
public class RootCauseDto {
    private int rank;
    private String variable;
    private double estimatedEffect;
    private double standardError;
    private double confidence;
    private double pValue;
    private double confidenceIntervalLower;
    private double confidenceIntervalUpper;
    private List<String> pathToOutcome;
    private List<String> adjustmentSet;
    private int sampleSize;
    private Double placeboEffect;
    private Double placeboPValue;
    private Boolean refutationPassed;
}
