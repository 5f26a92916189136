package com.z254.butterfly.prism.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.z254.butterfly.prism.config.PrismProperties;
import com.z254.butterfly.prism.rca.DiscoveryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Latest discovery result per outcome variable, for REST and visualization.
 * <p>
 * A result older than the cached one for the same outcome (lower snapshot version)
 * never replaces it.
 */
@Slf4j
@Component
public class DiscoveryResultCache {

    private final Cache<String, DiscoveryResult> results;

    public DiscoveryResultCache(PrismProperties prismProperties) {
        Duration ttl = prismProperties.getCache().getResultTtl();
        int maxOutcomes = prismProperties.getCache().getMaxOutcomes();

        this.results = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxOutcomes)
                .recordStats()
                .build();

        log.info("Initialized discovery result cache: ttl={}, maxOutcomes={}", ttl, maxOutcomes);
    }

    /**
     * Store a result unless a result from a newer snapshot is already cached.
     *
     * @return true when the result was stored
     */
    public boolean put(DiscoveryResult result) {
        DiscoveryResult stored = results.asMap().merge(result.getOutcomeVariable(), result,
                (existing, candidate) ->
                        candidate.getSnapshotVersion() >= existing.getSnapshotVersion() ? candidate : existing);
        return stored == result;
    }

    public Optional<DiscoveryResult> getLatest(String outcomeVariable) {
        return Optional.ofNullable(results.getIfPresent(outcomeVariable));
    }

    public void invalidate(String outcomeVariable) {
        results.invalidate(outcomeVariable);
    }

    public long size() {
        return results.estimatedSize();
    }

    public CacheStats stats() {
        return results.stats();
    }
}
