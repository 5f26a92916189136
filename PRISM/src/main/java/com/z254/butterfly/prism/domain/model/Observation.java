package com.z254.butterfly.prism.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One anomaly sample reported by a service.
 * <p>
 * Immutable once recorded. Metric values are always finite; values that were
 * missing or non-numeric at ingestion time are simply absent from {@link #getMetrics()}.
 */
@Value
public class Observation {

    /** Event time reported by the producer */
    Instant timestamp;

    /** Reporting service identity */
    String serviceId;

    /** Metric name to value, sorted by name */
    Map<String, Double> metrics;

    @Builder
    private Observation(Instant timestamp, String serviceId, @Singular Map<String, Double> metrics) {
        this.timestamp = timestamp;
        this.serviceId = serviceId;
        this.metrics = Collections.unmodifiableSortedMap(new TreeMap<>(metrics));
    }

    /**
     * Value of a metric, or {@link Double#NaN} when this observation does not carry it.
     */
    public double valueOf(String metric) {
        Double value = metrics.get(metric);
        return value != null ? value : Double.NaN;
    }
}
