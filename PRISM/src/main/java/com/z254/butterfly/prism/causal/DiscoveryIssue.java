package com.z254.butterfly.prism.causal;

/**
 * Non-fatal conditions met during a discovery pass.
 * <p>
 * None of these abort a pass; each is resolved conservatively and counted in
 * {@link DiscoveryDiagnostics}.
 */
public enum DiscoveryIssue {
    /** Too few complete rows for a test or estimate; edge kept, candidate dropped */
    INSUFFICIENT_DATA,
    /** Variable without variance; excluded from analysis */
    DEGENERATE_VARIABLE,
    /** Ill-conditioned or singular matrix; test skipped, edge kept, candidate dropped */
    NUMERIC_INSTABILITY,
    /** No directed or undetermined path from candidate to outcome; candidate excluded */
    NO_PATH_TO_OUTCOME
}
