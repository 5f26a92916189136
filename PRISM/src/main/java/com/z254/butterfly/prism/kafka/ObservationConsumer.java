package com.z254.butterfly.prism.kafka;

import com.z254.butterfly.prism.ingest.IngestionResult;
import com.z254.butterfly.prism.ingest.ObservationIngestionService;
import com.z254.butterfly.prism.ingest.ObservationMessage;
import com.z254.butterfly.prism.observability.PrismMetrics;
import com.z254.butterfly.prism.observability.PrismStructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for observations.
 * Malformed records are logged and acknowledged so they never block the partition.
 */
@Slf4j
@Component
public class ObservationConsumer {

    private final ObservationIngestionService ingestionService;
    private final PrismMetrics metrics;

    public ObservationConsumer(ObservationIngestionService ingestionService, PrismMetrics metrics) {
        this.ingestionService = ingestionService;
        this.metrics = metrics;
    }

    @KafkaListener(
            topics = "${prism.kafka.topics.observations:prism.observations}",
            groupId = "${spring.kafka.consumer.group-id:prism-service}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, ObservationMessage> record, Acknowledgment ack) {
        MDC.put(PrismStructuredLogger.MDC_CORRELATION_ID, record.topic() + "-" + record.partition() + "-" + record.offset());
        try {
            ObservationMessage message = record.value();
            if (message == null) {
                metrics.recordIngestionError();
                log.warn("Skipping unreadable observation at partition {} offset {}",
                        record.partition(), record.offset());
                return;
            }
            IngestionResult result = ingestionService.ingest(message);
            log.debug("Ingested observation from {}: window size {}", message.getServiceId(), result.getWindowSize());
        } catch (Exception e) {
            metrics.recordIngestionError();
            log.error("Failed to ingest observation at partition {} offset {}: {}",
                    record.partition(), record.offset(), e.getMessage(), e);
        } finally {
            ack.acknowledge();
            MDC.remove(PrismStructuredLogger.MDC_CORRELATION_ID);
        }
    }
}
