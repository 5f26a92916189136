package com.z254.butterfly.prism.causal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RootCauseRanker}.
 */
class RootCauseRankerTest {

    private RootCauseRanker ranker;

    @BeforeEach
    void setUp() {
        ranker = new RootCauseRanker();
    }

    private static RootCauseCandidate candidate(String variable, double effect, int pathLength, double confidence) {
        List<String> path = new ArrayList<>();
        path.add(variable);
        for (int i = 1; i < pathLength; i++) {
            path.add("hop" + i);
        }
        path.add("latency_ms");
        return RootCauseCandidate.builder()
                .variable(variable)
                .estimatedEffect(effect)
                .confidence(confidence)
                .pathToOutcome(path)
                .sampleSize(100)
                .build();
    }

    @Test
    @DisplayName("should rank by absolute effect, negative effects included")
    void ranksByAbsoluteEffect() {
        List<RootCauseCandidate> ranked = ranker.rank(List.of(
                candidate("cpu", 0.5, 1, 0.99),
                candidate("cache_hit_rate", -4.0, 1, 0.9),
                candidate("lock_wait_ms", 3.0, 1, 0.99)));

        assertThat(ranked).extracting(RootCauseCandidate::getVariable)
                .containsExactly("cache_hit_rate", "lock_wait_ms", "cpu");
    }

    @Test
    @DisplayName("should break effect ties by shorter path, then confidence, then name")
    void tieBreaks() {
        List<RootCauseCandidate> ranked = ranker.rank(List.of(
                candidate("d", 2.0, 1, 0.7),
                candidate("c", 2.0, 1, 0.7),
                candidate("b", 2.0, 1, 0.9),
                candidate("a", -2.0, 2, 0.99)));

        assertThat(ranked).extracting(RootCauseCandidate::getVariable)
                .containsExactly("b", "c", "d", "a");
    }

    @Test
    @DisplayName("should cap the ranking at the limit")
    void limit() {
        List<RootCauseCandidate> ranked = ranker.rank(List.of(
                candidate("a", 1.0, 1, 0.9),
                candidate("b", 2.0, 1, 0.9),
                candidate("c", 3.0, 1, 0.9)), 2);

        assertThat(ranked).extracting(RootCauseCandidate::getVariable).containsExactly("c", "b");
    }

    @Test
    @DisplayName("should return an unmodifiable list")
    void unmodifiable() {
        List<RootCauseCandidate> ranked = ranker.rank(List.of(candidate("a", 1.0, 1, 0.9)));

        assertThatThrownBy(() -> ranked.add(candidate("b", 1.0, 1, 0.9)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
