package com.z254.butterfly.prism.causal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link OrientationEngine}.
 */
class OrientationEngineTest {

    private OrientationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new OrientationEngine();
    }

    /**
     * Skeleton from "A-B" edge strings and separating sets for the non-adjacent pairs.
     */
    private static Skeleton skeleton(List<String> variables, List<String> edges,
                                     Map<VariablePair, List<String>> separatingSets) {
        Map<String, TreeSet<String>> adjacency = new TreeMap<>();
        variables.forEach(v -> adjacency.put(v, new TreeSet<>()));
        for (String edge : edges) {
            String[] ends = edge.split("-");
            adjacency.get(ends[0]).add(ends[1]);
            adjacency.get(ends[1]).add(ends[0]);
        }
        return new Skeleton(variables, adjacency, separatingSets,
                List.of(Skeleton.edgesOf(adjacency)), 1, false);
    }

    @Nested
    @DisplayName("Collider rule")
    class ColliderTests {

        @Test
        @DisplayName("should orient an unshielded collider when the middle is outside the separating set")
        void orientsCollider() {
            CausalGraph graph = engine.orient(skeleton(List.of("A", "B", "C"), List.of("A-C", "B-C"),
                    Map.of(VariablePair.of("A", "B"), List.of())));

            assertThat(graph.edge("A", "C")).contains(CausalEdge.directed("A", "C"));
            assertThat(graph.edge("B", "C")).contains(CausalEdge.directed("B", "C"));
            assertThat(graph.parentsOf("C")).containsExactly("A", "B");
            assertThat(graph.childrenOf("A")).containsExactly("C");
            assertThat(graph.undeterminedNeighboursOf("C")).isEmpty();
        }

        @Test
        @DisplayName("should leave a chain undetermined when the middle separates its ends")
        void leavesNonColliderUndetermined() {
            CausalGraph graph = engine.orient(skeleton(List.of("A", "B", "C"), List.of("A-C", "B-C"),
                    Map.of(VariablePair.of("A", "B"), List.of("C"))));

            assertThat(graph.directedEdges()).isEmpty();
            assertThat(graph.undeterminedNeighboursOf("C")).containsExactly("A", "B");
            assertThat(graph.getEdges()).containsExactly(
                    CausalEdge.undetermined("A", "C"), CausalEdge.undetermined("B", "C"));
        }

        @Test
        @DisplayName("should make an edge claimed in both directions by two colliders undetermined")
        void conflictingCollidersLockEdge() {
            // A - B - C - D with colliders at B (A, C) and at C (B, D)
            CausalGraph graph = engine.orient(skeleton(List.of("A", "B", "C", "D"),
                    List.of("A-B", "B-C", "C-D"),
                    Map.of(VariablePair.of("A", "C"), List.of(),
                            VariablePair.of("B", "D"), List.of(),
                            VariablePair.of("A", "D"), List.of())));

            assertThat(graph.edge("B", "C")).contains(CausalEdge.undetermined("B", "C"));
            assertThat(graph.edge("A", "B")).contains(CausalEdge.directed("A", "B"));
            assertThat(graph.edge("C", "D")).contains(CausalEdge.directed("D", "C"));
        }
    }

    @Nested
    @DisplayName("Propagation")
    class PropagationTests {

        @Test
        @DisplayName("should orient away from a collider when the far end is not adjacent")
        void meekRuleOne() {
            CausalGraph graph = engine.orient(skeleton(List.of("W", "X", "Y", "Z"),
                    List.of("X-Z", "Y-Z", "W-Z"),
                    Map.of(VariablePair.of("X", "Y"), List.of(),
                            VariablePair.of("W", "X"), List.of("Z"),
                            VariablePair.of("W", "Y"), List.of("Z"))));

            assertThat(graph.edge("Z", "W")).contains(CausalEdge.directed("Z", "W"));
            assertThat(graph.causalPath("X", "W")).containsExactly("X", "Z", "W");
            assertThat(graph.causalPath("W", "X")).isEmpty();
        }

        @Test
        @DisplayName("should orient a shortcut along an existing directed path")
        void meekRuleTwo() {
            // A -> C <- B from the collider, C -> D by R1, then A - D follows A -> C -> D
            CausalGraph graph = engine.orient(skeleton(List.of("A", "B", "C", "D"),
                    List.of("A-C", "B-C", "C-D", "A-D"),
                    Map.of(VariablePair.of("A", "B"), List.of(),
                            VariablePair.of("B", "D"), List.of("C"))));

            assertThat(graph.edge("C", "D")).contains(CausalEdge.directed("C", "D"));
            assertThat(graph.edge("A", "D")).contains(CausalEdge.directed("A", "D"));
        }

        @Test
        @DisplayName("should orient toward a collider fed by two non-adjacent undetermined neighbours")
        void meekRuleThree() {
            // c -> b <- d from the collider; a - c, a - d stay undetermined, so a - b becomes a -> b
            CausalGraph graph = engine.orient(skeleton(List.of("a", "b", "c", "d"),
                    List.of("a-b", "a-c", "a-d", "b-c", "b-d"),
                    Map.of(VariablePair.of("c", "d"), List.of("a"))));

            assertThat(graph.edge("c", "b")).contains(CausalEdge.directed("c", "b"));
            assertThat(graph.edge("d", "b")).contains(CausalEdge.directed("d", "b"));
            assertThat(graph.edge("a", "b")).contains(CausalEdge.directed("a", "b"));
            assertThat(graph.edge("a", "c")).contains(CausalEdge.undetermined("a", "c"));
            assertThat(graph.edge("a", "d")).contains(CausalEdge.undetermined("a", "d"));
        }

        @Test
        @DisplayName("should lock an edge when both of its orientations are unsafe")
        void locksEdgeWithoutSafeOrientation() {
            // a -> x <- w and b -> w <- y from colliders. R1 asks for x -> y, which closes
            // y -> w -> x into a cycle; y -> x would make a -> x <- y a new collider.
            Map<VariablePair, List<String>> sepsets = new TreeMap<>();
            sepsets.put(VariablePair.of("a", "b"), List.of());
            sepsets.put(VariablePair.of("a", "w"), List.of());
            sepsets.put(VariablePair.of("a", "y"), List.of("x"));
            sepsets.put(VariablePair.of("b", "x"), List.of("w"));
            sepsets.put(VariablePair.of("b", "y"), List.of());

            CausalGraph graph = engine.orient(skeleton(List.of("a", "b", "w", "x", "y"),
                    List.of("a-x", "b-w", "w-x", "w-y", "x-y"), sepsets));

            assertThat(graph.edge("a", "x")).contains(CausalEdge.directed("a", "x"));
            assertThat(graph.edge("w", "x")).contains(CausalEdge.directed("w", "x"));
            assertThat(graph.edge("y", "w")).contains(CausalEdge.directed("y", "w"));
            assertThat(graph.edge("x", "y")).contains(CausalEdge.undetermined("x", "y"));
            assertThat(graph.hasDirectedCycle()).isFalse();
        }
    }

    @Nested
    @DisplayName("Cycle guard")
    class CycleGuardTests {

        private Skeleton colliderTriangle() {
            // p -> y <- x, q -> z <- y and r -> x <- z orient the triangle x -> y -> z -> x
            Map<VariablePair, List<String>> sepsets = new TreeMap<>();
            sepsets.put(VariablePair.of("p", "x"), List.of());
            sepsets.put(VariablePair.of("p", "z"), List.of("y"));
            sepsets.put(VariablePair.of("q", "y"), List.of());
            sepsets.put(VariablePair.of("q", "x"), List.of("z"));
            sepsets.put(VariablePair.of("r", "z"), List.of());
            sepsets.put(VariablePair.of("r", "y"), List.of("x"));
            sepsets.put(VariablePair.of("p", "q"), List.of());
            sepsets.put(VariablePair.of("p", "r"), List.of());
            sepsets.put(VariablePair.of("q", "r"), List.of());
            return skeleton(List.of("p", "q", "r", "x", "y", "z"),
                    List.of("p-y", "q-z", "r-x", "x-y", "y-z", "x-z"), sepsets);
        }

        @Test
        @DisplayName("should make the lowest edge of a directed cycle undetermined")
        void breaksCycleAtLowestEdge() {
            CausalGraph graph = engine.orient(colliderTriangle());

            assertThat(graph.edge("x", "y")).contains(CausalEdge.undetermined("x", "y"));
            assertThat(graph.edge("y", "z")).contains(CausalEdge.directed("y", "z"));
            assertThat(graph.edge("z", "x")).contains(CausalEdge.directed("z", "x"));
            assertThat(graph.hasDirectedCycle()).isFalse();
        }

        @Test
        @DisplayName("should keep the pendant colliders while breaking the cycle")
        void keepsPendantOrientations() {
            CausalGraph graph = engine.orient(colliderTriangle());

            assertThat(graph.parentsOf("y")).containsExactly("p");
            assertThat(graph.parentsOf("z")).containsExactly("q", "y");
            assertThat(graph.parentsOf("x")).containsExactly("r", "z");
        }
    }

    @Nested
    @DisplayName("Graph invariants")
    class InvariantTests {

        private Skeleton dense() {
            List<String> variables = List.of("a", "b", "c", "d", "e");
            List<String> edges = List.of("a-b", "a-c", "b-c", "b-d", "c-d", "c-e", "d-e");
            Map<VariablePair, List<String>> sepsets = new TreeMap<>();
            sepsets.put(VariablePair.of("a", "d"), List.of());
            sepsets.put(VariablePair.of("a", "e"), List.of());
            sepsets.put(VariablePair.of("b", "e"), List.of());
            return skeleton(variables, edges, sepsets);
        }

        @Test
        @DisplayName("should never produce a directed cycle")
        void acyclic() {
            assertThat(engine.orient(dense()).hasDirectedCycle()).isFalse();
        }

        @Test
        @DisplayName("should never produce a self-edge")
        void noSelfEdges() {
            for (CausalEdge edge : engine.orient(dense()).getEdges()) {
                assertThat(edge.first()).isNotEqualTo(edge.second());
            }
        }

        @Test
        @DisplayName("should keep exactly the skeleton adjacencies")
        void preservesAdjacencies() {
            Skeleton skeleton = dense();
            List<VariablePair> pairs = new ArrayList<>();
            engine.orient(skeleton).getEdges().forEach(edge -> pairs.add(edge.pair()));

            assertThat(pairs).containsExactlyElementsOf(skeleton.edges());
        }

        @Test
        @DisplayName("should produce identical graphs on identical skeletons")
        void deterministic() {
            assertThat(engine.orient(dense())).isEqualTo(engine.orient(dense()));
        }
    }
}
