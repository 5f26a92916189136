package com.z254.butterfly.prism.ingest;

import com.z254.butterfly.prism.domain.model.Observation;
import com.z254.butterfly.prism.domain.store.ObservationStore;
import com.z254.butterfly.prism.observability.PrismMetrics;
import com.z254.butterfly.prism.observability.PrismStructuredLogger;
import com.z254.butterfly.prism.observability.PrismStructuredLogger.IngestionEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw observation messages into observations and appends them to the window.
 * <p>
 * Only numeric well-formedness is checked: a metric value that is missing, non-numeric,
 * NaN or infinite is dropped from that observation while the rest of the row is kept.
 */
@Slf4j
@Component
public class ObservationIngestionService {

    static final String UNKNOWN_SERVICE = "unknown";

    private final ObservationStore observationStore;
    private final PrismMetrics metrics;
    private final PrismStructuredLogger logger;
    private final Clock clock;

    @Autowired
    public ObservationIngestionService(ObservationStore observationStore,
                                       PrismMetrics metrics,
                                       PrismStructuredLogger logger) {
        this(observationStore, metrics, logger, Clock.systemUTC());
    }

    public ObservationIngestionService(ObservationStore observationStore,
                                       PrismMetrics metrics,
                                       PrismStructuredLogger logger,
                                       Clock clock) {
        this.observationStore = observationStore;
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    public IngestionResult ingest(ObservationMessage message) {
        return ingestAll(List.of(message));
    }

    public IngestionResult ingestAll(Collection<ObservationMessage> messages) {
        int accepted = 0;
        int rejected = 0;
        List<String> dropped = new ArrayList<>();

        for (ObservationMessage message : messages) {
            if (message == null) {
                rejected++;
                continue;
            }
            observationStore.append(toObservation(message, dropped));
            accepted++;
        }

        int windowSize = observationStore.size();
        metrics.recordObservationsAccepted(accepted, dropped.size(), windowSize);
        if (rejected > 0) {
            logger.logIngestionEvent(IngestionEventType.MESSAGE_REJECTED,
                    "Rejected empty observation messages", Map.of("rejected", rejected));
        }
        if (!dropped.isEmpty()) {
            logger.logIngestionEvent(IngestionEventType.VALUES_DROPPED,
                    "Dropped non-numeric metric values",
                    Map.of("dropped", dropped.size(), "metrics", String.join(",", dropped)));
        }
        logger.logIngestionEvent(IngestionEventType.BATCH_ACCEPTED, "Observations appended",
                Map.of("accepted", accepted, "rejected", rejected, "windowSize", windowSize));

        return IngestionResult.builder()
                .accepted(accepted)
                .rejected(rejected)
                .droppedValues(List.copyOf(dropped))
                .windowSize(windowSize)
                .windowVersion(observationStore.version())
                .build();
    }

    Observation toObservation(ObservationMessage message, List<String> dropped) {
        Observation.ObservationBuilder builder = Observation.builder()
                .timestamp(message.getTimestamp() != null ? message.getTimestamp() : clock.instant())
                .serviceId(message.getServiceId() != null && !message.getServiceId().isBlank()
                        ? message.getServiceId()
                        : UNKNOWN_SERVICE);

        if (message.getMetrics() != null) {
            message.getMetrics().forEach((name, raw) -> {
                if (name == null || name.isBlank()) {
                    return;
                }
                Optional<Double> value = toFiniteDouble(raw);
                if (value.isPresent()) {
                    builder.metric(name, value.get());
                } else {
                    dropped.add(name);
                }
            });
        }
        return builder.build();
    }

    /**
     * Numbers and numeric strings that denote a finite value.
     */
    static Optional<Double> toFiniteDouble(Object raw) {
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String text) {
            try {
                value = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }
}
