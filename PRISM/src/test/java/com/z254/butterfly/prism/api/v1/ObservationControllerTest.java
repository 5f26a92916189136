package com.z254.butterfly.prism.api.v1;

import com.z254.butterfly.prism.config.PrismProperties;
import com.z254.butterfly.prism.domain.store.ObservationSnapshot;
import com.z254.butterfly.prism.domain.store.ObservationStore;
import com.z254.butterfly.prism.ingest.IngestionResult;
import com.z254.butterfly.prism.ingest.ObservationIngestionService;
import com.z254.butterfly.prism.ingest.ObservationMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.z254.butterfly.prism.PrismTestData.observation;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

/**
 * Web layer tests for {@link ObservationController}.
 */
@WebFluxTest(ObservationController.class)
@Import(PrismProperties.class)
class ObservationControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ObservationIngestionService ingestionService;

    @MockBean
    private ObservationStore observationStore;

    private static IngestionResult accepted(int count) {
        return IngestionResult.builder()
                .accepted(count)
                .droppedValues(List.of())
                .windowSize(count)
                .windowVersion(count)
                .build();
    }

    @Test
    @DisplayName("should accept a single observation")
    void appendOne() {
        when(ingestionService.ingest(any(ObservationMessage.class))).thenReturn(accepted(1));

        webTestClient.post()
                .uri("/api/v1/observations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "timestamp", "2026-03-02T10:15:30Z",
                        "serviceId", "checkout-service",
                        "metrics", Map.of("latency_ms", 3000, "lock_wait_ms", 1000)))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.accepted").isEqualTo(1);
    }

    @Test
    @DisplayName("should accept a batch of observations")
    void appendBatch() {
        when(ingestionService.ingestAll(anyList())).thenReturn(accepted(2));

        webTestClient.post()
                .uri("/api/v1/observations/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(List.of(
                        Map.of("serviceId", "a", "metrics", Map.of("latency_ms", 1)),
                        Map.of("serviceId", "b", "metrics", Map.of("latency_ms", 2))))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.accepted").isEqualTo(2)
                .jsonPath("$.windowSize").isEqualTo(2);
    }

    @Test
    @DisplayName("should describe the current window")
    void window() {
        Instant now = Instant.parse("2026-03-02T10:15:30Z");
        when(observationStore.snapshot()).thenReturn(new ObservationSnapshot(7, List.of(
                observation(now.minusSeconds(10), Map.of("latency_ms", 100.0)),
                observation(now, Map.of("latency_ms", 120.0, "lock_wait_ms", 5.0)))));

        webTestClient.get()
                .uri("/api/v1/observations/window")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.size").isEqualTo(2)
                .jsonPath("$.version").isEqualTo(7)
                .jsonPath("$.variables[0]").isEqualTo("latency_ms")
                .jsonPath("$.variables[1]").isEqualTo("lock_wait_ms")
                .jsonPath("$.maxObservations").isEqualTo(1000);
    }
}
