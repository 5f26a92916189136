package com.z254.butterfly.prism.kafka;

import com.z254.butterfly.prism.ingest.IngestionResult;
import com.z254.butterfly.prism.ingest.ObservationIngestionService;
import com.z254.butterfly.prism.ingest.ObservationMessage;
import com.z254.butterfly.prism.observability.PrismMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ObservationConsumer}.
 */
@ExtendWith(MockitoExtension.class)
class ObservationConsumerTest {

    @Mock
    private ObservationIngestionService ingestionService;

    @Mock
    private Acknowledgment ack;

    private SimpleMeterRegistry meterRegistry;
    private ObservationConsumer consumer;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        consumer = new ObservationConsumer(ingestionService, new PrismMetrics(meterRegistry));
    }

    private double errors() {
        return meterRegistry.get("prism.observations.errors").counter().count();
    }

    @Test
    @DisplayName("should ingest and acknowledge a valid record")
    void ingestsRecord() {
        ObservationMessage message = ObservationMessage.builder()
                .timestamp(Instant.parse("2026-03-02T10:15:30Z"))
                .serviceId("checkout-service")
                .metrics(Map.of("latency_ms", 3000))
                .build();
        when(ingestionService.ingest(message)).thenReturn(IngestionResult.builder()
                .accepted(1)
                .droppedValues(List.of())
                .windowSize(1)
                .windowVersion(1)
                .build());

        consumer.consume(new ConsumerRecord<>("prism.observations", 0, 42L, "checkout-service", message), ack);

        verify(ingestionService).ingest(message);
        verify(ack).acknowledge();
        assertThat(errors()).isZero();
    }

    @Test
    @DisplayName("should acknowledge an unreadable record without ingesting it")
    void skipsUnreadable() {
        consumer.consume(new ConsumerRecord<>("prism.observations", 0, 43L, "checkout-service", null), ack);

        verifyNoInteractions(ingestionService);
        verify(ack).acknowledge();
        assertThat(errors()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should acknowledge when ingestion fails")
    void acknowledgesOnFailure() {
        when(ingestionService.ingest(any())).thenThrow(new IllegalStateException("store unavailable"));
        ObservationMessage message = ObservationMessage.builder().metrics(Map.of("latency_ms", 1)).build();

        consumer.consume(new ConsumerRecord<>("prism.observations", 1, 7L, null, message), ack);

        verify(ack).acknowledge();
        assertThat(errors()).isEqualTo(1.0);
    }
}
