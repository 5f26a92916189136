package com.z254.butterfly.prism.rca;

import com.z254.butterfly.prism.causal.*;
import com.z254.butterfly.prism.config.PrismProperties;
import com.z254.butterfly.prism.domain.store.ObservationSnapshot;
import com.z254.butterfly.prism.domain.store.ObservationStore;
import com.z254.butterfly.prism.observability.PrismMetrics;
import com.z254.butterfly.prism.observability.PrismStructuredLogger;
import com.z254.butterfly.prism.observability.PrismStructuredLogger.DiscoveryEventType;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Causal discovery orchestrator.
 * <p>
 * One pass runs the pipeline over a point-in-time snapshot of the observation window:
 * <ol>
 *     <li>Exclude degenerate variables</li>
 *     <li>Build the skeleton with Fisher-z independence tests</li>
 *     <li>Orient edges</li>
 *     <li>Estimate the effect of every other variable on the outcome</li>
 *     <li>Rank the candidates</li>
 * </ol>
 * Passes share nothing but the read-only store, so they may run concurrently.
 */
@Slf4j
@Service
public class CausalDiscoveryService {

    private final ObservationStore observationStore;
    private final SkeletonBuilder skeletonBuilder;
    private final OrientationEngine orientationEngine;
    private final EffectEstimator effectEstimator;
    private final RootCauseRanker ranker;
    private final PrismProperties prismProperties;
    private final PrismMetrics metrics;
    private final PrismStructuredLogger logger;

    public CausalDiscoveryService(ObservationStore observationStore,
                                  SkeletonBuilder skeletonBuilder,
                                  OrientationEngine orientationEngine,
                                  EffectEstimator effectEstimator,
                                  RootCauseRanker ranker,
                                  PrismProperties prismProperties,
                                  PrismMetrics metrics,
                                  PrismStructuredLogger logger) {
        this.observationStore = observationStore;
        this.skeletonBuilder = skeletonBuilder;
        this.orientationEngine = orientationEngine;
        this.effectEstimator = effectEstimator;
        this.ranker = ranker;
        this.prismProperties = prismProperties;
        this.metrics = metrics;
        this.logger = logger;
    }

    /**
     * Run a pass for the outcome with the configured significance and conditioning depth.
     */
    public DiscoveryResult runDiscovery(String outcomeVariable) {
        return runDiscovery(DiscoveryRequest.forOutcome(outcomeVariable));
    }

    /**
     * Run a pass on a bounded elastic worker.
     */
    public Mono<DiscoveryResult> discover(DiscoveryRequest request) {
        return Mono.fromCallable(() -> runDiscovery(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Run one discovery pass.
     *
     * @throws DiscoveryRejectedException if the request cannot be served; nothing is changed
     * @throws CausalDiscoveryException   if the pass fails unexpectedly
     */
    public DiscoveryResult runDiscovery(DiscoveryRequest request) {
        String passId = UUID.randomUUID().toString();
        PrismProperties.Discovery defaults = prismProperties.getDiscovery();
        String outcome = request.getOutcomeVariable();
        double alpha = request.getSignificanceThreshold() != null
                ? request.getSignificanceThreshold()
                : defaults.getSignificanceThreshold();
        int maxConditioningSize = request.getMaxConditioningSize() != null
                ? request.getMaxConditioningSize()
                : defaults.getMaxConditioningSize();

        ObservationSnapshot snapshot = observationStore.snapshot();
        validate(passId, outcome, alpha, maxConditioningSize, snapshot);

        Instant startedAt = Instant.now();
        Timer.Sample timerSample = metrics.startPassTimer();
        logger.logDiscoveryEvent(passId, outcome, DiscoveryEventType.PASS_STARTED,
                "Starting causal discovery pass",
                Map.of(
                        "snapshotVersion", snapshot.getVersion(),
                        "observations", snapshot.size(),
                        "variables", snapshot.getVariables().size(),
                        "significanceThreshold", alpha,
                        "maxConditioningSize", maxConditioningSize
                ));

        try {
            DiscoveryResult result = performDiscovery(passId, outcome, alpha, maxConditioningSize,
                    snapshot, startedAt);
            DiscoveryDiagnostics diagnostics = result.getDiagnostics();

            metrics.recordPassCompleted(timerSample,
                    diagnostics.getTestsPerformed(),
                    result.getGraph().getEdges().size(),
                    result.getCandidates().size(),
                    result.topCandidate().map(RootCauseCandidate::getConfidence).orElse(0.0));
            metrics.recordIssues(diagnostics.getIssueCounts());
            reportOutcome(result);
            return result;
        } catch (RuntimeException e) {
            metrics.recordPassFailed(timerSample);
            logger.logDiscoveryEvent(passId, outcome, DiscoveryEventType.PASS_FAILED,
                    "Causal discovery pass failed: " + e.getMessage(),
                    Map.of("error", e.getClass().getSimpleName()));
            throw new CausalDiscoveryException("Discovery pass " + passId + " failed", e);
        }
    }

    private void validate(String passId, String outcome, double alpha, int maxConditioningSize,
                          ObservationSnapshot snapshot) {
        String reason = null;
        if (outcome == null || outcome.isBlank()) {
            reason = "Outcome variable is required";
        } else if (!(alpha > 0.0 && alpha < 1.0)) {
            reason = "Significance threshold must be in (0, 1): " + alpha;
        } else if (maxConditioningSize < 0) {
            reason = "Max conditioning size must not be negative: " + maxConditioningSize;
        } else if (!snapshot.getVariables().contains(outcome)) {
            reason = "Outcome variable '" + outcome + "' is absent from the observation window";
        }

        if (reason != null) {
            metrics.recordPassRejected();
            logger.logDiscoveryEvent(passId, outcome, DiscoveryEventType.PASS_REJECTED,
                    "Discovery request rejected: " + reason,
                    Map.of("snapshotVersion", snapshot.getVersion(), "observations", snapshot.size()));
            throw new DiscoveryRejectedException(reason);
        }
    }

    /**
     * Core pipeline over one snapshot.
     */
    private DiscoveryResult performDiscovery(String passId, String outcome, double alpha,
                                             int maxConditioningSize, ObservationSnapshot snapshot,
                                             Instant startedAt) {
        PrismProperties.Discovery settings = prismProperties.getDiscovery();
        DataMatrix data = DataMatrix.from(snapshot);
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        // Step 1: variables with variance
        List<String> usable = new ArrayList<>();
        for (String variable : data.getVariables()) {
            if (data.isDegenerate(variable)) {
                diagnostics.exclude(variable, DiscoveryIssue.DEGENERATE_VARIABLE);
            } else {
                usable.add(variable);
            }
        }
        log.debug("Pass {}: {} usable of {} variables", passId, usable.size(), data.getVariables().size());

        // Step 2: skeleton
        IndependenceTester tester = new FisherZIndependenceTester(alpha, settings.getMaxConditionNumber());
        DiscoveryBudget budget = DiscoveryBudget.forPass(usable.size(), maxConditioningSize,
                settings.getBudgetFactor(), settings.getMaxPassDuration());
        Skeleton skeleton = skeletonBuilder.build(usable, data, maxConditioningSize, tester, budget, diagnostics);

        // Step 3: orientation
        CausalGraph graph = orientationEngine.orient(skeleton);

        // Step 4: effect estimation
        List<RootCauseCandidate> candidates = new ArrayList<>();
        if (graph.contains(outcome)) {
            for (String variable : graph.getVariables()) {
                if (variable.equals(outcome)) {
                    continue;
                }
                EffectEstimation estimation = effectEstimator.estimate(variable, outcome, graph, data, alpha);
                if (estimation.isEstimated()) {
                    candidates.add(estimation.getCandidate());
                } else {
                    diagnostics.exclude(variable, estimation.getIssue());
                }
            }
        } else {
            log.debug("Pass {}: outcome {} is degenerate, no candidates", passId, outcome);
        }

        // Step 5: ranking
        List<RootCauseCandidate> ranked = ranker.rank(candidates, settings.getMaxCandidates());

        return DiscoveryResult.builder()
                .passId(passId)
                .outcomeVariable(outcome)
                .snapshotVersion(snapshot.getVersion())
                .sampleSize(snapshot.size())
                .significanceThreshold(alpha)
                .maxConditioningSize(maxConditioningSize)
                .graph(graph)
                .candidates(ranked)
                .diagnostics(diagnostics.build(skeleton))
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .build();
    }

    private void reportOutcome(DiscoveryResult result) {
        String passId = result.getPassId();
        String outcome = result.getOutcomeVariable();
        DiscoveryDiagnostics diagnostics = result.getDiagnostics();

        if (diagnostics.isBudgetExhausted()) {
            metrics.recordBudgetExhausted();
            logger.logDiscoveryEvent(passId, outcome, DiscoveryEventType.BUDGET_EXHAUSTED,
                    "Independence test budget exhausted, remaining edges kept",
                    Map.of("testsPerformed", diagnostics.getTestsPerformed(),
                            "levelsCompleted", diagnostics.getLevelsCompleted()));
        }

        Optional<RootCauseCandidate> top = result.topCandidate();
        double minConfidence = prismProperties.getDiscovery().getMinConfidenceThreshold();
        if (top.isPresent() && top.get().getConfidence() < minConfidence) {
            logger.logDiscoveryEvent(passId, outcome, DiscoveryEventType.LOW_CONFIDENCE,
                    "Top root cause below confidence threshold",
                    Map.of("variable", top.get().getVariable(),
                            "confidence", top.get().getConfidence(),
                            "threshold", minConfidence));
        }

        Map<String, Object> details = new HashMap<>();
        details.put("edges", result.getGraph().getEdges().size());
        details.put("directedEdges", result.getGraph().directedEdges().size());
        details.put("candidates", result.getCandidates().size());
        details.put("testsPerformed", diagnostics.getTestsPerformed());
        details.put("excluded", diagnostics.getExcludedVariables().toString());
        top.ifPresent(candidate -> {
            details.put("topCause", candidate.getVariable());
            details.put("topEffect", candidate.getEstimatedEffect());
        });
        logger.logDiscoveryEvent(passId, outcome, DiscoveryEventType.PASS_COMPLETED,
                "Causal discovery pass completed", details);
        logger.logPerformance("discovery.pass",
                Duration.between(result.getStartedAt(), result.getCompletedAt()), true,
                Map.of("passId", passId, "variables", result.getGraph().getVariables().size()));
    }

    /**
     * A discovery pass failed unexpectedly.
     */
    public static class CausalDiscoveryException extends RuntimeException {
        public CausalDiscoveryException(String message) {
            super(message);
        }

        public CausalDiscoveryException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * A discovery request could not be served; the store and prior results are untouched.
     */
    public static class DiscoveryRejectedException extends CausalDiscoveryException {
        public DiscoveryRejectedException(String message) {
            super(message);
        }
    }
}
