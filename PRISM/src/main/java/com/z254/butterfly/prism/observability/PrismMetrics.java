package com.z254.butterfly.prism.observability;

import com.z254.butterfly.prism.causal.DiscoveryIssue;
import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for PRISM service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Observation ingestion (accepted, dropped values, window size)</li>
 *     <li>Discovery passes (latency, outcome, graph size, candidates)</li>
 *     <li>Non-fatal discovery conditions</li>
 *     <li>Trigger supersession</li>
 * </ul>
 */
@Component
public class PrismMetrics {

    private final MeterRegistry meterRegistry;

    // Ingestion metrics
    @Getter
    private final Counter observationsAccepted;
    @Getter
    private final Counter valuesDropped;
    @Getter
    private final Counter ingestionErrors;
    private final AtomicInteger windowSize;

    // Discovery metrics
    @Getter
    private final Counter passesStarted;
    @Getter
    private final Counter passesCompleted;
    @Getter
    private final Counter passesRejected;
    @Getter
    private final Counter passesFailed;
    @Getter
    private final Counter passesSuperseded;
    @Getter
    private final Counter budgetExhausted;
    private final Timer passLatency;
    private final DistributionSummary independenceTests;
    private final DistributionSummary graphEdges;
    private final DistributionSummary candidatesRanked;
    private final DistributionSummary topConfidence;
    private final AtomicInteger activePasses;
    private final Map<DiscoveryIssue, Counter> issues = new EnumMap<>(DiscoveryIssue.class);

    public PrismMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        // Initialize ingestion metrics
        this.observationsAccepted = Counter.builder("prism.observations.accepted")
                .description("Observations appended to the window")
                .register(meterRegistry);
        this.valuesDropped = Counter.builder("prism.observations.values.dropped")
                .description("Metric values dropped as non-numeric or missing")
                .register(meterRegistry);
        this.ingestionErrors = Counter.builder("prism.observations.errors")
                .description("Observation messages that could not be processed")
                .register(meterRegistry);
        this.windowSize = meterRegistry.gauge("prism.observations.window.size", new AtomicInteger(0));

        // Initialize discovery metrics
        this.passesStarted = Counter.builder("prism.discovery.passes.started")
                .description("Discovery passes started")
                .register(meterRegistry);
        this.passesCompleted = Counter.builder("prism.discovery.passes.completed")
                .description("Discovery passes completed")
                .register(meterRegistry);
        this.passesRejected = Counter.builder("prism.discovery.passes.rejected")
                .description("Discovery requests rejected")
                .register(meterRegistry);
        this.passesFailed = Counter.builder("prism.discovery.passes.failed")
                .description("Discovery passes failed unexpectedly")
                .register(meterRegistry);
        this.passesSuperseded = Counter.builder("prism.discovery.passes.superseded")
                .description("Discovery results discarded because a newer pass started")
                .register(meterRegistry);
        this.budgetExhausted = Counter.builder("prism.discovery.budget.exhausted")
                .description("Passes that ran out of independence test budget")
                .register(meterRegistry);
        this.passLatency = Timer.builder("prism.discovery.latency")
                .description("Discovery pass latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        this.independenceTests = DistributionSummary.builder("prism.discovery.tests")
                .description("Independence tests performed per pass")
                .register(meterRegistry);
        this.graphEdges = DistributionSummary.builder("prism.discovery.graph.edges")
                .description("Edges in the discovered graph")
                .register(meterRegistry);
        this.candidatesRanked = DistributionSummary.builder("prism.discovery.candidates.count")
                .description("Ranked root-cause candidates per pass")
                .register(meterRegistry);
        this.topConfidence = DistributionSummary.builder("prism.discovery.confidence")
                .description("Confidence of the top ranked candidate")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);
        this.activePasses = meterRegistry.gauge("prism.discovery.passes.active", new AtomicInteger(0));

        for (DiscoveryIssue issue : DiscoveryIssue.values()) {
            issues.put(issue, Counter.builder("prism.discovery.issues")
                    .description("Non-fatal conditions handled during discovery")
                    .tag("issue", issue.name().toLowerCase())
                    .register(meterRegistry));
        }
    }

    // ========== Ingestion Methods ==========

    public void recordObservationsAccepted(int count, int dropped, int currentWindowSize) {
        observationsAccepted.increment(count);
        valuesDropped.increment(dropped);
        windowSize.set(currentWindowSize);
    }

    public void recordIngestionError() {
        ingestionErrors.increment();
    }

    // ========== Discovery Methods ==========

    public Timer.Sample startPassTimer() {
        passesStarted.increment();
        activePasses.incrementAndGet();
        return Timer.start(meterRegistry);
    }

    public void recordPassCompleted(Timer.Sample sample, int tests, int edges, int candidates,
                                    double topCandidateConfidence) {
        sample.stop(passLatency);
        activePasses.decrementAndGet();
        passesCompleted.increment();
        independenceTests.record(tests);
        graphEdges.record(edges);
        candidatesRanked.record(candidates);
        if (candidates > 0) {
            topConfidence.record(topCandidateConfidence);
        }
    }

    public void recordPassFailed(Timer.Sample sample) {
        sample.stop(passLatency);
        activePasses.decrementAndGet();
        passesFailed.increment();
    }

    public void recordPassRejected() {
        passesRejected.increment();
    }

    public void recordPassSuperseded() {
        passesSuperseded.increment();
    }

    public void recordBudgetExhausted() {
        budgetExhausted.increment();
    }

    public void recordIssues(Map<DiscoveryIssue, Integer> counts) {
        counts.forEach((issue, count) -> issues.get(issue).increment(count));
    }

    public int getActivePasses() {
        return activePasses.get();
    }

    public int getWindowSize() {
        return windowSize.get();
    }
}
