package com.z254.butterfly.prism.health;

import com.z254.butterfly.prism.cache.DiscoveryResultCache;
import com.z254.butterfly.prism.config.PrismProperties;
import com.z254.butterfly.prism.domain.store.ObservationStore;
import com.z254.butterfly.prism.observability.PrismMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for PRISM service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Observation window fill and version</li>
 *     <li>Discovery passes in flight and cached results</li>
 *     <li>Trigger configuration</li>
 * </ul>
 */
@Slf4j
@Component
public class PrismHealthIndicator implements ReactiveHealthIndicator {

    private final ObservationStore observationStore;
    private final DiscoveryResultCache resultCache;
    private final PrismMetrics metrics;
    private final PrismProperties prismProperties;

    public PrismHealthIndicator(ObservationStore observationStore,
                                DiscoveryResultCache resultCache,
                                PrismMetrics metrics,
                                PrismProperties prismProperties) {
        this.observationStore = observationStore;
        this.resultCache = resultCache;
        this.metrics = metrics;
        this.prismProperties = prismProperties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();

        try {
            int size = observationStore.size();
            int maxObservations = prismProperties.getWindow().getMaxObservations();
            details.put("window.size", size);
            details.put("window.version", observationStore.version());
            details.put("window.capacity", size >= maxObservations ? "FULL" : "AVAILABLE");
        } catch (Exception e) {
            log.error("Health check failed for observation window", e);
            return Health.down()
                    .withDetail("window.error", "Failed to read observation window: " + e.getMessage())
                    .build();
        }

        details.put("activePasses", metrics.getActivePasses());
        details.put("cachedResults", resultCache.size());
        details.put("cache.hitRate", resultCache.stats().hitRate());
        details.put("trigger.enabled", prismProperties.getTrigger().isEnabled());
        details.put("trigger.outcomes", String.join(",", prismProperties.getTrigger().getOutcomes()));
        details.put("significanceThreshold", prismProperties.getDiscovery().getSignificanceThreshold());

        return Health.up().withDetails(details).build();
    }
}
