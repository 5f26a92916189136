package com.z254.butterfly.prism.causal;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either an estimated candidate or the reason the candidate was dropped.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EffectEstimation {

    RootCauseCandidate candidate;

    DiscoveryIssue issue;

    public static EffectEstimation estimated(RootCauseCandidate candidate) {
        return new EffectEstimation(candidate, null);
    }

    public static EffectEstimation excluded(DiscoveryIssue issue) {
        return new EffectEstimation(null, issue);
    }

    public boolean isEstimated() {
        return candidate != null;
    }
}
