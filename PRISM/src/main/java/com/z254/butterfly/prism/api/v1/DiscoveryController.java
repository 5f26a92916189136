package com.z254.butterfly.prism.api.v1;

import com.z254.butterfly.prism.api.dto.CausalGraphDto;
import com.z254.butterfly.prism.api.dto.DiscoveryResultDto;
import com.z254.butterfly.prism.api.mapper.DiscoveryMapper;
import com.z254.butterfly.prism.cache.DiscoveryResultCache;
import com.z254.butterfly.prism.config.PrismProperties;
import com.z254.butterfly.prism.kafka.DiscoveryResultProducer;
import com.z254.butterfly.prism.rca.CausalDiscoveryService;
import com.z254.butterfly.prism.rca.CausalDiscoveryService.DiscoveryRejectedException;
import com.z254.butterfly.prism.rca.DiscoveryRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * REST API controller for causal discovery.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/discovery")
@Tag(name = "Discovery", description = "Causal discovery passes, graphs and root causes")
public class DiscoveryController {

    private final CausalDiscoveryService discoveryService;
    private final DiscoveryResultCache resultCache;
    private final DiscoveryResultProducer resultProducer;
    private final PrismProperties prismProperties;

    public DiscoveryController(CausalDiscoveryService discoveryService,
                               DiscoveryResultCache resultCache,
                               DiscoveryResultProducer resultProducer,
                               PrismProperties prismProperties) {
        this.discoveryService = discoveryService;
        this.resultCache = resultCache;
        this.resultProducer = resultProducer;
        this.prismProperties = prismProperties;
    }

    @PostMapping
    @Operation(summary = "Run discovery", description = "Run a causal discovery pass for an outcome variable")
    public Mono<ResponseEntity<DiscoveryResponse>> runDiscovery(@RequestBody DiscoveryRequestBody request) {
        log.info("Manual discovery requested for outcome: {}", request.getOutcomeVariable());

        DiscoveryRequest discoveryRequest = DiscoveryRequest.builder()
                .outcomeVariable(request.getOutcomeVariable())
                .significanceThreshold(request.getSignificanceThreshold())
                .maxConditioningSize(request.getMaxConditioningSize())
                .build();

        return discoveryService.discover(discoveryRequest)
                .map(result -> {
                    resultCache.put(result);
                    resultProducer.publish(result);
                    return ResponseEntity.ok(DiscoveryResponse.builder()
                            .result(DiscoveryMapper.toDto(result))
                            .build());
                })
                .onErrorResume(DiscoveryRejectedException.class, error ->
                        Mono.just(ResponseEntity.badRequest().body(DiscoveryResponse.builder()
                                .error(error.getMessage())
                                .build())))
                .onErrorResume(error -> {
                    log.error("Discovery failed: {}", error.getMessage());
                    return Mono.just(ResponseEntity.internalServerError().body(DiscoveryResponse.builder()
                            .error(error.getMessage())
                            .build()));
                });
    }

    @GetMapping("/{outcome}")
    @Operation(summary = "Latest result", description = "Latest cached discovery result for an outcome variable")
    public Mono<ResponseEntity<DiscoveryResultDto>> getLatest(
            @Parameter(description = "Outcome variable") @PathVariable String outcome) {

        return Mono.justOrEmpty(resultCache.getLatest(outcome))
                .map(DiscoveryMapper::toDto)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{outcome}/graph")
    @Operation(summary = "Latest graph", description = "Edges of the latest causal graph for an outcome variable")
    public Mono<ResponseEntity<CausalGraphDto>> getGraph(
            @Parameter(description = "Outcome variable") @PathVariable String outcome) {

        return Mono.justOrEmpty(resultCache.getLatest(outcome))
                .map(DiscoveryMapper::toGraphDto)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/config")
    @Operation(summary = "Get discovery config", description = "Get current discovery configuration")
    public Mono<ResponseEntity<DiscoveryConfig>> getConfig() {
        PrismProperties.Discovery discovery = prismProperties.getDiscovery();
        PrismProperties.Window window = prismProperties.getWindow();

        return Mono.just(ResponseEntity.ok(DiscoveryConfig.builder()
                .significanceThreshold(discovery.getSignificanceThreshold())
                .maxConditioningSize(discovery.getMaxConditioningSize())
                .maxConditionNumber(discovery.getMaxConditionNumber())
                .budgetFactor(discovery.getBudgetFactor())
                .maxPassDuration(discovery.getMaxPassDuration().toString())
                .maxCandidates(discovery.getMaxCandidates())
                .minConfidenceThreshold(discovery.getMinConfidenceThreshold())
                .windowMaxObservations(window.getMaxObservations())
                .windowMaxAge(window.getMaxAge().toString())
                .placeboEnabled(prismProperties.getEstimation().isPlaceboEnabled())
                .build()));
    }

    // ========== Request/Response DTOs ==========

    @lombok.Data
    public static class DiscoveryRequestBody {
        private String outcomeVariable;
        private Double significanceThreshold;
        private Integer maxConditioningSize;
    }

    @lombok.Data
    @lombok.Builder
    public static class DiscoveryResponse {
        private DiscoveryResultDto result;
        private String error;
    }

    @lombok.Data
    @lombok.Builder
    public static class DiscoveryConfig {
        private double significanceThreshold;
        private int maxConditioningSize;
        private double maxConditionNumber;
        private int budgetFactor;
        private String maxPassDuration;
        private int maxCandidates;
        private double minConfidenceThreshold;
        private int windowMaxObservations;
        private String windowMaxAge;
        private boolean placeboEnabled;
    }
}
