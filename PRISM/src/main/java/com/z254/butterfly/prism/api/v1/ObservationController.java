package com.z254.butterfly.prism.api.v1;

import com.z254.butterfly.prism.api.dto.WindowStatsDto;
import com.z254.butterfly.prism.config.PrismProperties;
import com.z254.butterfly.prism.domain.store.ObservationSnapshot;
import com.z254.butterfly.prism.domain.store.ObservationStore;
import com.z254.butterfly.prism.ingest.IngestionResult;
import com.z254.butterfly.prism.ingest.ObservationIngestionService;
import com.z254.butterfly.prism.ingest.ObservationMessage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * REST API controller for observation ingestion.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/observations")
@Tag(name = "Observations", description = "Observation ingestion and window inspection")
public class ObservationController {

    private final ObservationIngestionService ingestionService;
    private final ObservationStore observationStore;
    private final PrismProperties prismProperties;

    public ObservationController(ObservationIngestionService ingestionService,
                                 ObservationStore observationStore,
                                 PrismProperties prismProperties) {
        this.ingestionService = ingestionService;
        this.observationStore = observationStore;
        this.prismProperties = prismProperties;
    }

    @PostMapping
    @Operation(summary = "Append observation", description = "Append one observation to the window")
    public Mono<ResponseEntity<IngestionResult>> append(@RequestBody ObservationMessage message) {
        return Mono.fromCallable(() -> ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ingestionService.ingest(message)));
    }

    @PostMapping("/batch")
    @Operation(summary = "Append observations", description = "Append a batch of observations in order")
    public Mono<ResponseEntity<IngestionResult>> appendBatch(@RequestBody List<ObservationMessage> messages) {
        log.debug("Received observation batch of {}", messages.size());
        return Mono.fromCallable(() -> ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ingestionService.ingestAll(messages)));
    }

    @GetMapping("/window")
    @Operation(summary = "Window statistics", description = "Size, version and variables of the observation window")
    public Mono<ResponseEntity<WindowStatsDto>> getWindow() {
        return Mono.fromCallable(() -> {
            ObservationSnapshot snapshot = observationStore.snapshot();
            PrismProperties.Window window = prismProperties.getWindow();
            return ResponseEntity.ok(WindowStatsDto.builder()
                    .size(snapshot.size())
                    .version(snapshot.getVersion())
                    .variables(new ArrayList<>(snapshot.getVariables()))
                    .oldestTimestamp(snapshot.oldestTimestamp().orElse(null))
                    .newestTimestamp(snapshot.newestTimestamp().orElse(null))
                    .maxObservations(window.getMaxObservations())
                    .maxAge(window.getMaxAge().toString())
                    .build());
        });
    }
}
