package com.z254.butterfly.prism.causal;

/**
 * Edge of a {@link CausalGraph}; endpoints are distinct and ordered ({@code first < second}).
 */
public record CausalEdge(String first, String second, EdgeDirection direction)
        implements Comparable<CausalEdge> {

    public CausalEdge {
        if (first == null || second == null || first.compareTo(second) >= 0) {
            throw new IllegalArgumentException("Edge endpoints must be ordered and distinct: "
                    + first + ", " + second);
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction is required");
        }
    }

    public static CausalEdge directed(String from, String to) {
        return from.compareTo(to) < 0
                ? new CausalEdge(from, to, EdgeDirection.FIRST_TO_SECOND)
                : new CausalEdge(to, from, EdgeDirection.SECOND_TO_FIRST);
    }

    public static CausalEdge undetermined(String a, String b) {
        VariablePair pair = VariablePair.of(a, b);
        return new CausalEdge(pair.first(), pair.second(), EdgeDirection.UNDETERMINED);
    }

    public VariablePair pair() {
        return new VariablePair(first, second);
    }

    public boolean isDirected() {
        return direction != EdgeDirection.UNDETERMINED;
    }

    /**
     * Tail of a directed edge, or {@code null} when undetermined.
     */
    public String source() {
        return switch (direction) {
            case FIRST_TO_SECOND -> first;
            case SECOND_TO_FIRST -> second;
            case UNDETERMINED -> null;
        };
    }

    /**
     * Head of a directed edge, or {@code null} when undetermined.
     */
    public String target() {
        return switch (direction) {
            case FIRST_TO_SECOND -> second;
            case SECOND_TO_FIRST -> first;
            case UNDETERMINED -> null;
        };
    }

    @Override
    public int compareTo(CausalEdge o) {
        return pair().compareTo(o.pair());
    }

    @Override
    public String toString() {
        return switch (direction) {
            case FIRST_TO_SECOND -> first + " -> " + second;
            case SECOND_TO_FIRST -> second + " -> " + first;
            case UNDETERMINED -> first + " -- " + second;
        };
    }
}
