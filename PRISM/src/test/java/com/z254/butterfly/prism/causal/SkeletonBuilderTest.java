package com.z254.butterfly.prism.causal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import static com.z254.butterfly.prism.PrismTestData.columns;
import static com.z254.butterfly.prism.PrismTestData.factor;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SkeletonBuilder}.
 */
class SkeletonBuilderTest {

    private static final List<String> VARIABLES = List.of("W", "X", "Y", "Z");

    private SkeletonBuilder builder;
    private IndependenceTester tester;
    private DataMatrix colliderData;

    @BeforeEach
    void setUp() {
        builder = new SkeletonBuilder();
        tester = new FisherZIndependenceTester(0.05, 1e10);
        // X -> Z <- Y, Z -> W
        colliderData = columns(128)
                .column("X", row -> factor(row, 0))
                .column("Y", row -> factor(row, 1))
                .column("Z", row -> factor(row, 0) + factor(row, 1) + factor(row, 2))
                .column("W", row -> factor(row, 0) + factor(row, 1) + factor(row, 2) + factor(row, 3))
                .toMatrix();
    }

    private Skeleton build(DataMatrix data, List<String> variables, DiscoveryBudget budget,
                           DiagnosticsCollector diagnostics) {
        return builder.build(variables, data, 3, tester, budget, diagnostics);
    }

    @Nested
    @DisplayName("Adjacency search")
    class AdjacencySearchTests {

        @Test
        @DisplayName("should keep exactly the true adjacencies")
        void recoversTrueAdjacencies() {
            Skeleton skeleton = build(colliderData, VARIABLES, DiscoveryBudget.unlimited(), new DiagnosticsCollector());

            assertThat(skeleton.edges()).containsExactly(
                    VariablePair.of("W", "Z"),
                    VariablePair.of("X", "Z"),
                    VariablePair.of("Y", "Z"));
        }

        @Test
        @DisplayName("should record the separating set of every removed edge")
        void recordsSeparatingSets() {
            Skeleton skeleton = build(colliderData, VARIABLES, DiscoveryBudget.unlimited(), new DiagnosticsCollector());

            assertThat(skeleton.separatingSet("X", "Y")).contains(List.of());
            assertThat(skeleton.separatingSet("W", "X")).contains(List.of("Z"));
            assertThat(skeleton.separatingSet("Y", "W")).contains(List.of("Z"));
            assertThat(skeleton.separatingSet("X", "Z")).isEmpty();
        }

        @Test
        @DisplayName("should only ever remove edges from one level to the next")
        void pruningIsMonotonic() {
            Skeleton skeleton = build(colliderData, VARIABLES, DiscoveryBudget.unlimited(), new DiagnosticsCollector());
            List<SortedSet<VariablePair>> levels = skeleton.getLevelEdges();

            assertThat(levels).hasSizeGreaterThan(1);
            assertThat(levels.get(0)).hasSize(6);
            for (int k = 1; k < levels.size(); k++) {
                assertThat(levels.get(k - 1)).containsAll(levels.get(k));
            }
        }

        @Test
        @DisplayName("should produce identical skeletons on identical data")
        void deterministic() {
            Skeleton first = build(colliderData, VARIABLES, DiscoveryBudget.unlimited(), new DiagnosticsCollector());
            Skeleton second = build(colliderData, List.of("Z", "Y", "X", "W"), DiscoveryBudget.unlimited(),
                    new DiagnosticsCollector());

            assertThat(second.edges()).isEqualTo(first.edges());
            assertThat(second.getSeparatingSets()).isEqualTo(first.getSeparatingSets());
            assertThat(second.getLevelEdges()).isEqualTo(first.getLevelEdges());
        }

        @Test
        @DisplayName("should never make a variable its own neighbour")
        void noSelfAdjacency() {
            Skeleton skeleton = build(colliderData, VARIABLES, DiscoveryBudget.unlimited(), new DiagnosticsCollector());

            for (String variable : VARIABLES) {
                assertThat(skeleton.neighbours(variable)).doesNotContain(variable);
            }
        }
    }

    @Nested
    @DisplayName("Conservative handling")
    class ConservativeTests {

        @Test
        @DisplayName("should keep an edge whose test has insufficient data")
        void insufficientDataKeepsEdge() {
            DataMatrix tiny = DataMatrix.of(Map.of(
                    "latency_ms", new double[]{100, 3000, 120},
                    "lock_wait_ms", new double[]{5, 1000, 10}));
            DiagnosticsCollector diagnostics = new DiagnosticsCollector();

            Skeleton skeleton = build(tiny, List.of("latency_ms", "lock_wait_ms"), DiscoveryBudget.unlimited(),
                    diagnostics);

            assertThat(skeleton.isAdjacent("latency_ms", "lock_wait_ms")).isTrue();
            assertThat(diagnostics.build(skeleton).count(DiscoveryIssue.INSUFFICIENT_DATA)).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep remaining edges once the test budget is exhausted")
        void budgetExhaustionKeepsEdges() {
            DiagnosticsCollector diagnostics = new DiagnosticsCollector();

            Skeleton skeleton = build(colliderData, VARIABLES, DiscoveryBudget.ofTests(1), diagnostics);

            assertThat(skeleton.isBudgetExhausted()).isTrue();
            assertThat(skeleton.edges()).hasSize(6);
            assertThat(diagnostics.getTestsPerformed()).isEqualTo(1);
        }

        @Test
        @DisplayName("should return an empty skeleton for fewer than two variables")
        void singleVariable() {
            Skeleton skeleton = build(colliderData, List.of("X"), DiscoveryBudget.unlimited(), new DiagnosticsCollector());

            assertThat(skeleton.edges()).isEmpty();
            assertThat(skeleton.getLevelsCompleted()).isZero();
        }
    }

    @Test
    @DisplayName("should enumerate subsets in lexicographic order")
    void subsetsInLexicographicOrder() {
        assertThat(SkeletonBuilder.subsets(List.of("a", "b", "c"), 2))
                .containsExactly(List.of("a", "b"), List.of("a", "c"), List.of("b", "c"));
        assertThat(SkeletonBuilder.subsets(List.of("a", "b"), 0)).containsExactly(List.of());
    }
}
