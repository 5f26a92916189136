package com.z254.butterfly.prism.ingest;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What an ingestion call kept and dropped.
 */
@Value
@Builder
public class IngestionResult {

    int accepted;

    int rejected;

    /** Metric values dropped as missing or non-numeric, as {@code metric} names */
    List<String> droppedValues;

    int windowSize;

    long windowVersion;
}
