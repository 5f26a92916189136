package com.z254.butterfly.prism.ingest;

import com.z254.butterfly.prism.config.PrismProperties;
import com.z254.butterfly.prism.domain.model.Observation;
import com.z254.butterfly.prism.domain.store.InMemoryObservationStore;
import com.z254.butterfly.prism.observability.PrismMetrics;
import com.z254.butterfly.prism.observability.PrismStructuredLogger;
import com.z254.butterfly.prism.observability.PrismStructuredLogger.IngestionEventType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link ObservationIngestionService}.
 */
@ExtendWith(MockitoExtension.class)
class ObservationIngestionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:15:30Z");

    @Mock
    private PrismStructuredLogger logger;

    private InMemoryObservationStore store;
    private SimpleMeterRegistry meterRegistry;
    private ObservationIngestionService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryObservationStore(new PrismProperties(), clock);
        meterRegistry = new SimpleMeterRegistry();
        service = new ObservationIngestionService(store, new PrismMetrics(meterRegistry), logger, clock);
    }

    private Observation only() {
        return store.snapshot().getObservations().get(0);
    }

    @Nested
    @DisplayName("Metric values")
    class MetricValueTests {

        @Test
        @DisplayName("should keep numeric values and drop the rest of the row's bad values")
        void dropsNonNumeric() {
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("latency_ms", 3000);
            metrics.put("lock_wait_ms", 1000.5);
            metrics.put("status", "degraded");
            metrics.put("pool_wait_ms", null);
            metrics.put("cpu_percent", Double.NaN);

            IngestionResult result = service.ingest(ObservationMessage.builder()
                    .timestamp(NOW.minusSeconds(5))
                    .serviceId("checkout-service")
                    .metrics(metrics)
                    .build());

            assertThat(result.getAccepted()).isEqualTo(1);
            assertThat(result.getDroppedValues()).containsExactly("status", "pool_wait_ms", "cpu_percent");
            assertThat(only().getMetrics())
                    .containsOnlyKeys("latency_ms", "lock_wait_ms")
                    .containsEntry("latency_ms", 3000.0);
            assertThat(meterRegistry.get("prism.observations.values.dropped").counter().count())
                    .isEqualTo(3.0);
            verify(logger).logIngestionEvent(eq(IngestionEventType.VALUES_DROPPED), anyString(), any());
        }

        @Test
        @DisplayName("should accept numeric strings")
        void numericStrings() {
            service.ingest(ObservationMessage.builder()
                    .timestamp(NOW)
                    .serviceId("checkout-service")
                    .metrics(Map.of("latency_ms", " 2500.25 "))
                    .build());

            assertThat(only().getMetrics()).containsEntry("latency_ms", 2500.25);
            verify(logger, never()).logIngestionEvent(eq(IngestionEventType.VALUES_DROPPED), anyString(), any());
        }

        @Test
        @DisplayName("should reject infinite values")
        void infinite() {
            assertThat(ObservationIngestionService.toFiniteDouble(Double.POSITIVE_INFINITY)).isEmpty();
            assertThat(ObservationIngestionService.toFiniteDouble("Infinity")).isEmpty();
            assertThat(ObservationIngestionService.toFiniteDouble(42L)).contains(42.0);
        }
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("should stamp missing timestamps and service ids")
        void defaults() {
            service.ingest(ObservationMessage.builder()
                    .serviceId(" ")
                    .metrics(Map.of("latency_ms", 100))
                    .build());

            assertThat(only().getTimestamp()).isEqualTo(NOW);
            assertThat(only().getServiceId()).isEqualTo(ObservationIngestionService.UNKNOWN_SERVICE);
        }

        @Test
        @DisplayName("should count null messages as rejected and append the others")
        void batchWithNulls() {
            IngestionResult result = service.ingestAll(Arrays.asList(
                    ObservationMessage.builder().timestamp(NOW).serviceId("a").metrics(Map.of("x", 1)).build(),
                    null,
                    ObservationMessage.builder().timestamp(NOW).serviceId("b").metrics(Map.of("x", 2)).build()));

            assertThat(result.getAccepted()).isEqualTo(2);
            assertThat(result.getRejected()).isEqualTo(1);
            assertThat(result.getWindowSize()).isEqualTo(2);
            assertThat(result.getWindowVersion()).isEqualTo(store.version());
        }
    }
}
