package com.z254.butterfly.prism.domain.store;

import com.z254.butterfly.prism.domain.model.Observation;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Point-in-time copy of the observation window.
 * <p>
 * A discovery pass works on exactly one snapshot, so concurrent ingestion never
 * changes the sample set under a running pass.
 */
public final class ObservationSnapshot {

    private final long version;
    private final List<Observation> observations;
    private final SortedSet<String> variables;

    public ObservationSnapshot(long version, List<Observation> observations) {
        this.version = version;
        this.observations = List.copyOf(observations);
        SortedSet<String> names = new TreeSet<>();
        for (Observation observation : this.observations) {
            names.addAll(observation.getMetrics().keySet());
        }
        this.variables = Collections.unmodifiableSortedSet(names);
    }

    public static ObservationSnapshot empty() {
        return new ObservationSnapshot(0L, List.of());
    }

    public long getVersion() {
        return version;
    }

    public List<Observation> getObservations() {
        return observations;
    }

    /**
     * Every metric name seen in the window, in lexicographic order.
     */
    public SortedSet<String> getVariables() {
        return variables;
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public Optional<Instant> oldestTimestamp() {
        return observations.stream().map(Observation::getTimestamp).min(Instant::compareTo);
    }

    public Optional<Instant> newestTimestamp() {
        return observations.stream().map(Observation::getTimestamp).max(Instant::compareTo);
    }
}
