package com.z254.butterfly.prism.causal;

import java.util.Objects;

/**
 * Unordered pair of distinct variables, stored with {@code first < second}.
 */
public record VariablePair(String first, String second) implements Comparable<VariablePair> {

    public VariablePair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.compareTo(second) >= 0) {
            throw new IllegalArgumentException(
                    "Pair must be ordered and distinct: " + first + ", " + second);
        }
    }

    public static VariablePair of(String a, String b) {
        if (a.equals(b)) {
            throw new IllegalArgumentException("Self pair not allowed: " + a);
        }
        return a.compareTo(b) < 0 ? new VariablePair(a, b) : new VariablePair(b, a);
    }

    public boolean contains(String variable) {
        return first.equals(variable) || second.equals(variable);
    }

    public String other(String variable) {
        if (first.equals(variable)) {
            return second;
        }
        if (second.equals(variable)) {
            return first;
        }
        throw new IllegalArgumentException(variable + " is not part of " + this);
    }

    @Override
    public int compareTo(VariablePair o) {
        int c = first.compareTo(o.first);
        return c != 0 ? c : second.compareTo(o.second);
    }

    @Override
    public String toString() {
        return first + "|" + second;
    }
}
