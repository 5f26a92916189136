package com.z254.butterfly.prism.causal;

import java.util.*;

/**
 * Partially directed causal graph over the variables of one discovery pass.
 * <p>
 * Immutable; built once per pass by the {@link OrientationEngine} and never
 * mutated afterwards. Invariants:
 * <ul>
 *     <li>No self-edges and at most one edge per variable pair</li>
 *     <li>The directed edges form an acyclic graph</li>
 *     <li>Variables and edges are kept in lexicographic order</li>
 * </ul>
 */
public final class CausalGraph {

    private final List<String> variables;
    private final List<CausalEdge> edges;
    private final SortedMap<VariablePair, List<String>> separatingSets;
    private final Map<VariablePair, CausalEdge> edgeIndex = new HashMap<>();
    private final Map<String, SortedSet<String>> parents = new HashMap<>();
    private final Map<String, SortedSet<String>> children = new HashMap<>();
    private final Map<String, SortedSet<String>> undetermined = new HashMap<>();

    public CausalGraph(Collection<String> variables,
                       Collection<CausalEdge> edges,
                       Map<VariablePair, List<String>> separatingSets) {
        this.variables = List.copyOf(new TreeSet<>(variables));
        List<CausalEdge> sorted = new ArrayList<>(edges);
        Collections.sort(sorted);
        this.edges = List.copyOf(sorted);
        this.separatingSets = Collections.unmodifiableSortedMap(new TreeMap<>(separatingSets));

        for (String variable : this.variables) {
            parents.put(variable, new TreeSet<>());
            children.put(variable, new TreeSet<>());
            undetermined.put(variable, new TreeSet<>());
        }
        for (CausalEdge edge : this.edges) {
            if (!parents.containsKey(edge.first()) || !parents.containsKey(edge.second())) {
                throw new IllegalArgumentException("Edge " + edge + " references an unknown variable");
            }
            if (edgeIndex.put(edge.pair(), edge) != null) {
                throw new IllegalArgumentException("Duplicate edge for pair " + edge.pair());
            }
            if (edge.isDirected()) {
                children.get(edge.source()).add(edge.target());
                parents.get(edge.target()).add(edge.source());
            } else {
                undetermined.get(edge.first()).add(edge.second());
                undetermined.get(edge.second()).add(edge.first());
            }
        }
    }

    public static CausalGraph empty(Collection<String> variables) {
        return new CausalGraph(variables, List.of(), Map.of());
    }

    public List<String> getVariables() {
        return variables;
    }

    public List<CausalEdge> getEdges() {
        return edges;
    }

    public SortedMap<VariablePair, List<String>> getSeparatingSets() {
        return separatingSets;
    }

    public boolean contains(String variable) {
        return parents.containsKey(variable);
    }

    public Optional<CausalEdge> edge(String a, String b) {
        if (a.equals(b)) {
            return Optional.empty();
        }
        return Optional.ofNullable(edgeIndex.get(VariablePair.of(a, b)));
    }

    public boolean isAdjacent(String a, String b) {
        return edge(a, b).isPresent();
    }

    public SortedSet<String> parentsOf(String variable) {
        return Collections.unmodifiableSortedSet(parents.getOrDefault(variable, new TreeSet<>()));
    }

    public SortedSet<String> childrenOf(String variable) {
        return Collections.unmodifiableSortedSet(children.getOrDefault(variable, new TreeSet<>()));
    }

    public SortedSet<String> undeterminedNeighboursOf(String variable) {
        return Collections.unmodifiableSortedSet(undetermined.getOrDefault(variable, new TreeSet<>()));
    }

    public List<CausalEdge> directedEdges() {
        return edges.stream().filter(CausalEdge::isDirected).toList();
    }

    /**
     * Shortest path from {@code from} to {@code to} that follows directed edges
     * forwards and undetermined edges either way. Neighbours are expanded in name
     * order, so ties between equally short paths resolve the same way every time.
     *
     * @return the path including both endpoints, or an empty list when none exists
     */
    public List<String> causalPath(String from, String to) {
        if (!contains(from) || !contains(to) || from.equals(to)) {
            return List.of();
        }
        Map<String, String> previous = new HashMap<>();
        Queue<String> queue = new LinkedList<>();
        queue.add(from);
        previous.put(from, from);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(to)) {
                break;
            }
            SortedSet<String> next = new TreeSet<>(children.get(current));
            next.addAll(undetermined.get(current));
            for (String neighbour : next) {
                if (!previous.containsKey(neighbour)) {
                    previous.put(neighbour, current);
                    queue.add(neighbour);
                }
            }
        }

        if (!previous.containsKey(to)) {
            return List.of();
        }
        LinkedList<String> path = new LinkedList<>();
        for (String step = to; !step.equals(from); step = previous.get(step)) {
            path.addFirst(step);
        }
        path.addFirst(from);
        return List.copyOf(path);
    }

    /**
     * True when the directed edges contain a cycle.
     */
    public boolean hasDirectedCycle() {
        Map<String, Integer> state = new HashMap<>();
        for (String variable : variables) {
            if (visit(variable, state)) {
                return true;
            }
        }
        return false;
    }

    private boolean visit(String variable, Map<String, Integer> state) {
        Integer mark = state.get(variable);
        if (mark != null) {
            return mark == 1;
        }
        state.put(variable, 1);
        for (String child : children.get(variable)) {
            if (visit(child, state)) {
                return true;
            }
        }
        state.put(variable, 2);
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CausalGraph other)) {
            return false;
        }
        return variables.equals(other.variables)
                && edges.equals(other.edges)
                && separatingSets.equals(other.separatingSets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variables, edges, separatingSets);
    }

    @Override
    public String toString() {
        return "CausalGraph{variables=" + variables + ", edges=" + edges + "}";
    }
}
