package com.z254.butterfly.prism.ingest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Observation as reported by a producer, before numeric filtering.
 * Metric values may be numbers, numeric strings or anything else.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservationMessage {

    private Instant timestamp;

    private String serviceId;

    @Builder.Default
    private Map<String, Object> metrics = new LinkedHashMap<>();
}
