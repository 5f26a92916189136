package com.z254.butterfly.prism.trigger;

import com.z254.butterfly.prism.cache.DiscoveryResultCache;
import com.z254.butterfly.prism.config.PrismProperties;
import com.z254.butterfly.prism.domain.store.ObservationStore;
import com.z254.butterfly.prism.kafka.DiscoveryResultProducer;
import com.z254.butterfly.prism.observability.PrismMetrics;
import com.z254.butterfly.prism.observability.PrismStructuredLogger;
import com.z254.butterfly.prism.observability.PrismStructuredLogger.DiscoveryEventType;
import com.z254.butterfly.prism.rca.CausalDiscoveryService;
import com.z254.butterfly.prism.rca.CausalDiscoveryService.DiscoveryRejectedException;
import com.z254.butterfly.prism.rca.DiscoveryRequest;
import com.z254.butterfly.prism.rca.DiscoveryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Threshold-gated discovery scheduling.
 * <p>
 * Every check counts the observations inside the anomaly window. When the count reaches the
 * threshold and the window changed since the last pass, a pass starts for each configured
 * outcome. A newer pass for an outcome supersedes the one in flight: the old subscription is
 * disposed and any result it still delivers is discarded, never published.
 */
@Slf4j
@Component
public class DiscoveryTrigger {

    private final ObservationStore observationStore;
    private final CausalDiscoveryService discoveryService;
    private final DiscoveryResultCache resultCache;
    private final DiscoveryResultProducer resultProducer;
    private final PrismProperties prismProperties;
    private final PrismMetrics metrics;
    private final PrismStructuredLogger logger;

    private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();
    private final Map<String, TriggeredPass> inFlight = new ConcurrentHashMap<>();
    private final Map<String, Long> lastTriggeredVersion = new ConcurrentHashMap<>();

    public DiscoveryTrigger(ObservationStore observationStore,
                            CausalDiscoveryService discoveryService,
                            DiscoveryResultCache resultCache,
                            DiscoveryResultProducer resultProducer,
                            PrismProperties prismProperties,
                            PrismMetrics metrics,
                            PrismStructuredLogger logger) {
        this.observationStore = observationStore;
        this.discoveryService = discoveryService;
        this.resultCache = resultCache;
        this.resultProducer = resultProducer;
        this.prismProperties = prismProperties;
        this.metrics = metrics;
        this.logger = logger;
    }

    @Scheduled(fixedDelayString = "${prism.trigger.check-interval-ms:10000}")
    public void checkThreshold() {
        PrismProperties.Trigger settings = prismProperties.getTrigger();
        if (!settings.isEnabled()) {
            return;
        }

        int recent = observationStore.countWithin(settings.getAnomalyWindow());
        if (recent < settings.getAnomalyThreshold()) {
            log.trace("{} observations in {}, below threshold {}",
                    recent, settings.getAnomalyWindow(), settings.getAnomalyThreshold());
            return;
        }

        long version = observationStore.version();
        for (String outcome : settings.getOutcomes()) {
            Long previous = lastTriggeredVersion.put(outcome, version);
            if (previous != null && previous == version) {
                continue;
            }
            log.debug("Threshold reached ({} observations), starting pass for {}", recent, outcome);
            trigger(outcome);
        }
    }

    /**
     * Start a pass for the outcome, superseding any pass still running for it.
     *
     * @return the generation number of the new pass
     */
    public long trigger(String outcome) {
        long generation = generations.computeIfAbsent(outcome, key -> new AtomicLong()).incrementAndGet();
        TriggeredPass pass = new TriggeredPass(generation);

        pass.subscription = discoveryService.discover(DiscoveryRequest.forOutcome(outcome))
                .subscribe(
                        result -> publishIfCurrent(outcome, pass, result),
                        error -> handleFailure(outcome, error));

        TriggeredPass previous = inFlight.put(outcome, pass);
        if (previous != null && !previous.subscription.isDisposed()) {
            previous.subscription.dispose();
            if (previous.markSuperseded()) {
                metrics.recordPassSuperseded();
                log.info("Superseded in-flight discovery pass for {} with generation {}", outcome, generation);
            }
        }
        return generation;
    }

    /**
     * Cache and publish a result only if no newer pass was started for its outcome.
     *
     * @return true when the result was published
     */
    boolean publishIfCurrent(String outcome, TriggeredPass pass, DiscoveryResult result) {
        if (pass.generation != currentGeneration(outcome)) {
            if (pass.markSuperseded()) {
                metrics.recordPassSuperseded();
            }
            logger.logDiscoveryEvent(result.getPassId(), outcome, DiscoveryEventType.PASS_SUPERSEDED,
                    "Discarding result of superseded discovery pass",
                    Map.of("generation", pass.generation, "currentGeneration", currentGeneration(outcome)));
            return false;
        }
        resultCache.put(result);
        resultProducer.publish(result);
        return true;
    }

    TriggeredPass inFlightPass(String outcome) {
        return inFlight.get(outcome);
    }

    public long currentGeneration(String outcome) {
        AtomicLong generation = generations.get(outcome);
        return generation != null ? generation.get() : 0L;
    }

    private void handleFailure(String outcome, Throwable error) {
        if (error instanceof DiscoveryRejectedException) {
            log.warn("Triggered discovery for {} rejected: {}", outcome, error.getMessage());
        } else {
            log.error("Triggered discovery for {} failed: {}", outcome, error.getMessage(), error);
        }
    }

    /**
     * One triggered pass; counted as superseded at most once, whichever of cancellation and
     * stale delivery notices it first.
     */
    static final class TriggeredPass {
        private final long generation;
        private final AtomicBoolean superseded = new AtomicBoolean();
        private volatile Disposable subscription;

        TriggeredPass(long generation) {
            this.generation = generation;
        }

        long generation() {
            return generation;
        }

        boolean markSuperseded() {
            return superseded.compareAndSet(false, true);
        }
    }
}
