package com.z254.butterfly.prism.domain.store;

import com.z254.butterfly.prism.domain.model.Observation;

import java.time.Duration;

/**
 * Append-only window of observations.
 */
public interface ObservationStore {

    /**
     * Append an observation, evicting the oldest entries when the window is full.
     */
    void append(Observation observation);

    /**
     * Consistent copy of the current window.
     */
    ObservationSnapshot snapshot();

    /**
     * Number of observations whose timestamp lies within {@code window} of now.
     */
    int countWithin(Duration window);

    /**
     * Monotonic counter bumped on every append or eviction.
     */
    long version();

    int size();

    void clear();
}
