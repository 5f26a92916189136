package com.z254.butterfly.prism.causal;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Turns a skeleton into a maximally oriented partially directed graph.
 * <p>
 * Steps:
 * <ol>
 *     <li>Collider rule: {@code A - C - B} with A, B non-adjacent and C outside their
 *     separating set becomes {@code A -> C <- B}</li>
 *     <li>Meek rules R1-R3 applied to a fixpoint</li>
 *     <li>Cycle guard: the lowest-ordered edge of any directed cycle is made undetermined</li>
 * </ol>
 * Triples and edges are visited in lexicographic order so the result is reproducible.
 */
@Slf4j
@Component
public class OrientationEngine {

    public CausalGraph orient(Skeleton skeleton) {
        WorkingGraph graph = new WorkingGraph(skeleton);

        int colliders = applyColliderRule(skeleton, graph);
        int propagated = propagate(graph);
        int broken = breakCycles(graph);

        CausalGraph result = graph.toCausalGraph(skeleton);
        log.debug("Oriented skeleton: edges={}, colliders={}, propagated={}, cyclesBroken={}, locked={}",
                result.getEdges().size(), colliders, propagated, broken, graph.lockedCount());
        return result;
    }

    private int applyColliderRule(Skeleton skeleton, WorkingGraph graph) {
        int colliders = 0;
        List<String> variables = skeleton.getVariables();
        for (int i = 0; i < variables.size(); i++) {
            String a = variables.get(i);
            for (int j = i + 1; j < variables.size(); j++) {
                String b = variables.get(j);
                if (graph.adjacent(a, b)) {
                    continue;
                }
                Optional<List<String>> separatingSet = skeleton.separatingSet(a, b);
                if (separatingSet.isEmpty()) {
                    continue;
                }
                SortedSet<String> common = new TreeSet<>(graph.neighbours(a));
                common.retainAll(graph.neighbours(b));
                for (String c : common) {
                    if (!separatingSet.get().contains(c)) {
                        graph.orientInto(a, c);
                        graph.orientInto(b, c);
                        colliders++;
                    }
                }
            }
        }
        return colliders;
    }

    private int propagate(WorkingGraph graph) {
        int oriented = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (VariablePair pair : graph.pairs()) {
                if (!graph.isUndirected(pair.first(), pair.second())) {
                    continue;
                }
                if (impliedByMeekRules(graph, pair.first(), pair.second())) {
                    graph.orientSafely(pair.first(), pair.second());
                } else if (impliedByMeekRules(graph, pair.second(), pair.first())) {
                    graph.orientSafely(pair.second(), pair.first());
                } else {
                    continue;
                }
                oriented++;
                changed = true;
            }
        }
        return oriented;
    }

    private boolean impliedByMeekRules(WorkingGraph graph, String x, String y) {
        SortedSet<String> neighbours = graph.neighbours(x);

        // R1: a -> x - y, a and y not adjacent
        for (String a : neighbours) {
            if (!a.equals(y) && graph.isDirected(a, x) && !graph.adjacent(a, y)) {
                return true;
            }
        }

        // R2: x -> m -> y with x - y
        for (String m : neighbours) {
            if (graph.isDirected(x, m) && graph.isDirected(m, y)) {
                return true;
            }
        }

        // R3: x - c -> y, x - d -> y, c and d not adjacent
        List<String> feeders = new ArrayList<>();
        for (String c : neighbours) {
            if (!c.equals(y) && graph.isUndirected(x, c) && graph.isDirected(c, y)) {
                feeders.add(c);
            }
        }
        for (int i = 0; i < feeders.size(); i++) {
            for (int j = i + 1; j < feeders.size(); j++) {
                if (!graph.adjacent(feeders.get(i), feeders.get(j))) {
                    return true;
                }
            }
        }
        return false;
    }

    private int breakCycles(WorkingGraph graph) {
        int broken = 0;
        Optional<List<VariablePair>> cycle;
        while ((cycle = graph.findDirectedCycle()).isPresent()) {
            VariablePair lowest = Collections.min(cycle.get());
            graph.lock(lowest);
            broken++;
            log.warn("Directed cycle {} detected, edge {} forced to undetermined", cycle.get(), lowest);
        }
        return broken;
    }

    /**
     * Mutable orientation state for one call of {@link #orient(Skeleton)}.
     */
    private static final class WorkingGraph {

        private enum Mark { UNDIRECTED, FIRST_TO_SECOND, SECOND_TO_FIRST, LOCKED }

        private final SortedMap<VariablePair, Mark> marks = new TreeMap<>();
        private final Map<String, SortedSet<String>> adjacency = new TreeMap<>();

        WorkingGraph(Skeleton skeleton) {
            for (String variable : skeleton.getVariables()) {
                adjacency.put(variable, skeleton.neighbours(variable));
            }
            for (VariablePair edge : skeleton.edges()) {
                marks.put(edge, Mark.UNDIRECTED);
            }
        }

        Set<VariablePair> pairs() {
            return marks.keySet();
        }

        SortedSet<String> neighbours(String variable) {
            return adjacency.getOrDefault(variable, Collections.emptySortedSet());
        }

        boolean adjacent(String a, String b) {
            return !a.equals(b) && marks.containsKey(VariablePair.of(a, b));
        }

        boolean isUndirected(String a, String b) {
            return adjacent(a, b) && marks.get(VariablePair.of(a, b)) == Mark.UNDIRECTED;
        }

        /**
         * True when the edge is oriented {@code from -> to}.
         */
        boolean isDirected(String from, String to) {
            if (!adjacent(from, to)) {
                return false;
            }
            VariablePair pair = VariablePair.of(from, to);
            Mark forward = pair.first().equals(from) ? Mark.FIRST_TO_SECOND : Mark.SECOND_TO_FIRST;
            return marks.get(pair) == forward;
        }

        void direct(String from, String to) {
            VariablePair pair = VariablePair.of(from, to);
            marks.put(pair, pair.first().equals(from) ? Mark.FIRST_TO_SECOND : Mark.SECOND_TO_FIRST);
        }

        void lock(VariablePair pair) {
            marks.put(pair, Mark.LOCKED);
        }

        int lockedCount() {
            return (int) marks.values().stream().filter(mark -> mark == Mark.LOCKED).count();
        }

        /**
         * Collider orientation; an edge claimed in both directions is locked undetermined.
         */
        void orientInto(String from, String collider) {
            VariablePair pair = VariablePair.of(from, collider);
            if (marks.get(pair) == Mark.UNDIRECTED) {
                direct(from, collider);
            } else if (isDirected(collider, from)) {
                lock(pair);
            }
        }

        /**
         * Orient {@code from -> to}, or the opposite if that would close a cycle or
         * introduce an unshielded collider, or lock the edge if both are unsafe.
         */
        void orientSafely(String from, String to) {
            if (!unsafe(from, to)) {
                direct(from, to);
            } else if (!unsafe(to, from)) {
                direct(to, from);
            } else {
                lock(VariablePair.of(from, to));
            }
        }

        private boolean unsafe(String from, String to) {
            return hasDirectedPath(to, from) || createsUnshieldedCollider(from, to);
        }

        private boolean createsUnshieldedCollider(String from, String to) {
            for (String z : neighbours(to)) {
                if (!z.equals(from) && isDirected(z, to) && !adjacent(z, from)) {
                    return true;
                }
            }
            return false;
        }

        private boolean hasDirectedPath(String from, String to) {
            Set<String> seen = new HashSet<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(from);
            while (!stack.isEmpty()) {
                String current = stack.pop();
                if (current.equals(to)) {
                    return true;
                }
                if (seen.add(current)) {
                    for (String next : neighbours(current)) {
                        if (isDirected(current, next)) {
                            stack.push(next);
                        }
                    }
                }
            }
            return false;
        }

        Optional<List<VariablePair>> findDirectedCycle() {
            Map<String, Integer> state = new HashMap<>();
            for (String variable : adjacency.keySet()) {
                Deque<String> path = new ArrayDeque<>();
                Optional<List<VariablePair>> cycle = dfs(variable, state, path);
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
            return Optional.empty();
        }

        private Optional<List<VariablePair>> dfs(String variable, Map<String, Integer> state,
                                                 Deque<String> path) {
            Integer mark = state.get(variable);
            if (mark != null && mark == 2) {
                return Optional.empty();
            }
            if (mark != null) {
                List<String> trail = new ArrayList<>(path);
                Collections.reverse(trail);
                int start = trail.indexOf(variable);
                List<VariablePair> cycle = new ArrayList<>();
                for (int i = start; i < trail.size(); i++) {
                    String next = i + 1 < trail.size() ? trail.get(i + 1) : variable;
                    cycle.add(VariablePair.of(trail.get(i), next));
                }
                return Optional.of(cycle);
            }
            state.put(variable, 1);
            path.push(variable);
            for (String next : neighbours(variable)) {
                if (isDirected(variable, next)) {
                    Optional<List<VariablePair>> cycle = dfs(next, state, path);
                    if (cycle.isPresent()) {
                        return cycle;
                    }
                }
            }
            path.pop();
            state.put(variable, 2);
            return Optional.empty();
        }

        CausalGraph toCausalGraph(Skeleton skeleton) {
            List<CausalEdge> edges = new ArrayList<>();
            marks.forEach((pair, mark) -> edges.add(switch (mark) {
                case FIRST_TO_SECOND -> new CausalEdge(pair.first(), pair.second(), EdgeDirection.FIRST_TO_SECOND);
                case SECOND_TO_FIRST -> new CausalEdge(pair.first(), pair.second(), EdgeDirection.SECOND_TO_FIRST);
                case UNDIRECTED, LOCKED -> new CausalEdge(pair.first(), pair.second(), EdgeDirection.UNDETERMINED);
            }));
            return new CausalGraph(skeleton.getVariables(), edges, skeleton.getSeparatingSets());
        }
    }
}
