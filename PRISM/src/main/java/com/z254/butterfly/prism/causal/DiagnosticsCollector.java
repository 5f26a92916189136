package com.z254.butterfly.prism.causal;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Mutable accumulator for {@link DiscoveryDiagnostics}, owned by one pass.
 */
public class DiagnosticsCollector {

    private final Map<DiscoveryIssue, Integer> issueCounts = new EnumMap<>(DiscoveryIssue.class);
    private final SortedMap<String, DiscoveryIssue> excluded = new TreeMap<>();
    private int testsPerformed;

    public void recordTest(IndependenceResult result) {
        testsPerformed++;
        DiscoveryIssue issue = result.issue();
        if (issue != null) {
            record(issue);
        }
    }

    public void record(DiscoveryIssue issue) {
        issueCounts.merge(issue, 1, Integer::sum);
    }

    public void exclude(String variable, DiscoveryIssue reason) {
        excluded.put(variable, reason);
        record(reason);
    }

    public int getTestsPerformed() {
        return testsPerformed;
    }

    public DiscoveryDiagnostics build(Skeleton skeleton) {
        return DiscoveryDiagnostics.builder()
                .issueCounts(Collections.unmodifiableMap(new EnumMap<>(issueCounts)))
                .excludedVariables(Collections.unmodifiableSortedMap(new TreeMap<>(excluded)))
                .testsPerformed(testsPerformed)
                .levelsCompleted(skeleton.getLevelsCompleted())
                .budgetExhausted(skeleton.isBudgetExhausted())
                .edgesPerLevel(skeleton.getLevelEdges().stream().map(Set::size).toList())
                .build();
    }
}
