package com.z254.butterfly.prism.causal;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * PC adjacency search.
 * <p>
 * Starts from the complete graph and, for conditioning-set sizes {@code 0..max},
 * removes every edge whose endpoints test independent given some subset of the
 * neighbours of either endpoint. Adjacency is frozen at the start of each level,
 * so the result does not depend on the order edges are visited in; neighbours
 * and subsets are still enumerated lexicographically so repeated runs perform
 * the same tests in the same order.
 */
@Slf4j
@Component
public class SkeletonBuilder {

    public Skeleton build(List<String> variables,
                          DataMatrix data,
                          int maxConditioningSize,
                          IndependenceTester tester,
                          DiscoveryBudget budget,
                          DiagnosticsCollector diagnostics) {
        List<String> ordered = new ArrayList<>(new TreeSet<>(variables));
        SortedMap<String, TreeSet<String>> adjacency = new TreeMap<>();
        for (String variable : ordered) {
            TreeSet<String> neighbours = new TreeSet<>(ordered);
            neighbours.remove(variable);
            adjacency.put(variable, neighbours);
        }

        Map<VariablePair, List<String>> separatingSets = new TreeMap<>();
        List<SortedSet<VariablePair>> levelEdges = new ArrayList<>();
        levelEdges.add(Skeleton.edgesOf(adjacency));

        if (ordered.size() < 2) {
            log.debug("Fewer than two usable variables, skeleton is empty");
            return new Skeleton(ordered, adjacency, separatingSets, levelEdges, 0, false);
        }

        int levelsCompleted = 0;
        for (int level = 0; level <= maxConditioningSize && !budget.isExhausted(); level++) {
            if (!canCondition(adjacency, level)) {
                break;
            }
            Map<String, List<String>> frozen = freeze(adjacency);

            for (VariablePair edge : Skeleton.edgesOf(adjacency)) {
                Optional<List<String>> separating =
                        findSeparatingSet(edge, frozen, level, data, tester, budget, diagnostics);
                if (separating.isPresent()) {
                    adjacency.get(edge.first()).remove(edge.second());
                    adjacency.get(edge.second()).remove(edge.first());
                    separatingSets.put(edge, separating.get());
                    log.trace("Removed edge {} given {}", edge, separating.get());
                }
                if (budget.isExhausted()) {
                    break;
                }
            }

            if (budget.isExhausted()) {
                log.warn("Independence test budget exhausted at level {} after {} tests, "
                        + "keeping remaining edges", level, budget.getConsumed());
                break;
            }
            levelEdges.add(Skeleton.edgesOf(adjacency));
            levelsCompleted++;
        }

        return new Skeleton(ordered, adjacency, separatingSets, levelEdges,
                levelsCompleted, budget.isExhausted());
    }

    private Optional<List<String>> findSeparatingSet(VariablePair edge,
                                                     Map<String, List<String>> frozen,
                                                     int level,
                                                     DataMatrix data,
                                                     IndependenceTester tester,
                                                     DiscoveryBudget budget,
                                                     DiagnosticsCollector diagnostics) {
        Set<List<String>> tried = new HashSet<>();
        for (String endpoint : List.of(edge.first(), edge.second())) {
            String other = edge.other(endpoint);
            List<String> candidates = new ArrayList<>(frozen.get(endpoint));
            candidates.remove(other);
            if (candidates.size() < level) {
                continue;
            }
            for (List<String> subset : subsets(candidates, level)) {
                // subsets drawn from both endpoints' neighbourhoods may coincide
                if (!tried.add(subset)) {
                    continue;
                }
                if (!budget.tryConsume()) {
                    return Optional.empty();
                }
                IndependenceResult result = tester.test(edge.first(), edge.second(), subset, data);
                diagnostics.recordTest(result);
                if (result.isIndependent()) {
                    return Optional.of(subset);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean canCondition(Map<String, TreeSet<String>> adjacency, int level) {
        for (VariablePair edge : Skeleton.edgesOf(adjacency)) {
            if (adjacency.get(edge.first()).size() - 1 >= level
                    || adjacency.get(edge.second()).size() - 1 >= level) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, List<String>> freeze(Map<String, TreeSet<String>> adjacency) {
        Map<String, List<String>> frozen = new TreeMap<>();
        adjacency.forEach((variable, neighbours) -> frozen.put(variable, List.copyOf(neighbours)));
        return frozen;
    }

    /**
     * All size-{@code k} subsets of a sorted list, in lexicographic order.
     */
    static List<List<String>> subsets(List<String> items, int k) {
        List<List<String>> subsets = new ArrayList<>();
        collect(items, k, 0, new ArrayList<>(k), subsets);
        return subsets;
    }

    private static void collect(List<String> items, int k, int start, List<String> current,
                                List<List<String>> out) {
        if (current.size() == k) {
            out.add(Collections.unmodifiableList(new ArrayList<>(current)));
            return;
        }
        for (int i = start; i <= items.size() - (k - current.size()); i++) {
            current.add(items.get(i));
            collect(items, k, i + 1, current, out);
            current.remove(current.size() - 1);
        }
    }
}
