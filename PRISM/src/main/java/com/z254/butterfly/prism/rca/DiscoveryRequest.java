package com.z254.butterfly.prism.rca;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one discovery pass. Null overrides fall back to the configured defaults.
 */
@Value
@Builder
public class DiscoveryRequest {

    String outcomeVariable;

    Double significanceThreshold;

    Integer maxConditioningSize;

    public static DiscoveryRequest forOutcome(String outcomeVariable) {
        return DiscoveryRequest.builder().outcomeVariable(outcomeVariable).build();
    }
}
