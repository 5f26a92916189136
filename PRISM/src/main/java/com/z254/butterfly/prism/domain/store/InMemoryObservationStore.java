package com.z254.butterfly.prism.domain.store;

import com.z254.butterfly.prism.config.PrismProperties;
import com.z254.butterfly.prism.domain.model.Observation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * In-memory observation window bounded by count and by age.
 * <p>
 * Appends, evictions and snapshots are serialized on one monitor; a snapshot is a
 * full copy taken under that monitor.
 */
@Slf4j
@Repository
public class InMemoryObservationStore implements ObservationStore {

    private final Deque<Observation> window = new ArrayDeque<>();
    private final int maxObservations;
    private final Duration maxAge;
    private final Clock clock;
    private long version;

    @Autowired
    public InMemoryObservationStore(PrismProperties prismProperties) {
        this(prismProperties, Clock.systemUTC());
    }

    public InMemoryObservationStore(PrismProperties prismProperties, Clock clock) {
        this.maxObservations = prismProperties.getWindow().getMaxObservations();
        this.maxAge = prismProperties.getWindow().getMaxAge();
        this.clock = clock;
    }

    @Override
    public synchronized void append(Observation observation) {
        window.addLast(observation);
        version++;
        evict();
    }

    @Override
    public synchronized ObservationSnapshot snapshot() {
        evict();
        return new ObservationSnapshot(version, new ArrayList<>(window));
    }

    @Override
    public synchronized int countWithin(Duration duration) {
        Instant cutoff = clock.instant().minus(duration);
        int count = 0;
        for (Observation observation : window) {
            if (!observation.getTimestamp().isBefore(cutoff)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized long version() {
        return version;
    }

    @Override
    public synchronized int size() {
        return window.size();
    }

    @Override
    public synchronized void clear() {
        if (!window.isEmpty()) {
            window.clear();
            version++;
        }
    }

    private void evict() {
        int evicted = 0;
        while (window.size() > maxObservations) {
            window.pollFirst();
            evicted++;
        }
        if (maxAge != null && !maxAge.isZero()) {
            Instant cutoff = clock.instant().minus(maxAge);
            evicted += removeOlderThan(cutoff);
        }
        if (evicted > 0) {
            version++;
            log.debug("Evicted {} observations from window, size={}", evicted, window.size());
        }
    }

    // Arrival order is not guaranteed to follow event time, so scan the whole window.
    private int removeOlderThan(Instant cutoff) {
        int before = window.size();
        window.removeIf(observation -> observation.getTimestamp().isBefore(cutoff));
        return before - window.size();
    }
}
