package com.z254.butterfly.prism.causal;

/**
 * Orientation of a {@link CausalEdge} relative to its lexicographically ordered endpoints.
 */
public enum EdgeDirection {
    /** first -> second */
    FIRST_TO_SECOND,
    /** second -> first */
    SECOND_TO_FIRST,
    /** Direction could not be established */
    UNDETERMINED
}
