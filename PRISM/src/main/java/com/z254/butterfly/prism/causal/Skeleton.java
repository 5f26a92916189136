package com.z254.butterfly.prism.causal;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Undirected dependency graph produced by the adjacency search, with the
 * separating set recorded for every removed edge.
 */
public final class Skeleton {

    private final List<String> variables;
    private final SortedMap<String, SortedSet<String>> adjacency;
    private final SortedMap<VariablePair, List<String>> separatingSets;
    private final List<SortedSet<VariablePair>> levelEdges;
    private final int levelsCompleted;
    private final boolean budgetExhausted;

    Skeleton(List<String> variables,
             Map<String, ? extends SortedSet<String>> adjacency,
             Map<VariablePair, List<String>> separatingSets,
             List<SortedSet<VariablePair>> levelEdges,
             int levelsCompleted,
             boolean budgetExhausted) {
        this.variables = List.copyOf(variables);
        SortedMap<String, SortedSet<String>> adj = new TreeMap<>();
        adjacency.forEach((k, v) -> adj.put(k, Collections.unmodifiableSortedSet(new TreeSet<>(v))));
        this.adjacency = Collections.unmodifiableSortedMap(adj);
        SortedMap<VariablePair, List<String>> sepsets = new TreeMap<>();
        separatingSets.forEach((k, v) -> sepsets.put(k, List.copyOf(v)));
        this.separatingSets = Collections.unmodifiableSortedMap(sepsets);
        this.levelEdges = levelEdges.stream()
                .map(edges -> Collections.unmodifiableSortedSet(new TreeSet<>(edges)))
                .toList();
        this.levelsCompleted = levelsCompleted;
        this.budgetExhausted = budgetExhausted;
    }

    public List<String> getVariables() {
        return variables;
    }

    public SortedSet<String> neighbours(String variable) {
        SortedSet<String> neighbours = adjacency.get(variable);
        return neighbours != null ? neighbours : Collections.emptySortedSet();
    }

    public boolean isAdjacent(String a, String b) {
        return neighbours(a).contains(b);
    }

    public SortedSet<VariablePair> edges() {
        return edgesOf(adjacency);
    }

    public Optional<List<String>> separatingSet(String a, String b) {
        return Optional.ofNullable(separatingSets.get(VariablePair.of(a, b)));
    }

    public SortedMap<VariablePair, List<String>> getSeparatingSets() {
        return separatingSets;
    }

    /**
     * Edge sets before any test (index 0) and after each completed level.
     */
    public List<SortedSet<VariablePair>> getLevelEdges() {
        return levelEdges;
    }

    public int getLevelsCompleted() {
        return levelsCompleted;
    }

    public boolean isBudgetExhausted() {
        return budgetExhausted;
    }

    static SortedSet<VariablePair> edgesOf(Map<String, ? extends SortedSet<String>> adjacency) {
        SortedSet<VariablePair> edges = new TreeSet<>();
        adjacency.forEach((a, neighbours) -> {
            for (String b : neighbours) {
                if (a.compareTo(b) < 0) {
                    edges.add(new VariablePair(a, b));
                }
            }
        });
        return edges;
    }
}
