package com.z254.butterfly.prism.causal;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * What a discovery pass had to work around.
 */
@Value
@Builder
public class DiscoveryDiagnostics {

    /** Occurrences of each non-fatal condition */
    Map<DiscoveryIssue, Integer> issueCounts;

    /** Variables left out of the graph or the candidate list, with the reason */
    SortedMap<String, DiscoveryIssue> excludedVariables;

    int testsPerformed;

    int levelsCompleted;

    boolean budgetExhausted;

    /** Skeleton edge count before testing and after each completed level */
    List<Integer> edgesPerLevel;

    public int count(DiscoveryIssue issue) {
        return issueCounts.getOrDefault(issue, 0);
    }
}
