package com.z254.butterfly.prism.causal;

import java.util.List;

/**
 * Conditional-independence test between two variables given a conditioning set.
 * <p>
 * Implementations are pure functions of their inputs and symmetric in {@code a} and
 * {@code b}. An undecided result is never independent, so callers that prune on
 * independence keep the edge.
 */
public interface IndependenceTester {

    IndependenceResult test(String a, String b, List<String> conditioningSet, DataMatrix data);

    double getSignificanceThreshold();
}
