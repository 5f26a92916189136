package com.z254.butterfly.prism.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for PRISM service.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context management for pass and correlation IDs</li>
 *     <li>Discovery and ingestion event logging</li>
 *     <li>Performance timing utilities</li>
 * </ul>
 */
@Slf4j
@Component
public class PrismStructuredLogger {

    // MDC keys
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_PASS_ID = "passId";
    public static final String MDC_OUTCOME = "outcome";

    /**
     * Log a discovery pass event.
     */
    public void logDiscoveryEvent(String passId, String outcome, DiscoveryEventType eventType,
                                  String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_PASS_ID, passId,
                MDC_OUTCOME, outcome != null ? outcome : ""))) {

            Map<String, Object> logData = new HashMap<>();
            logData.put("event", eventType.name());
            logData.put("passId", passId);
            if (outcome != null) {
                logData.put("outcome", outcome);
            }

            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case PASS_STARTED, PASS_COMPLETED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case PASS_REJECTED, PASS_SUPERSEDED, LOW_CONFIDENCE, BUDGET_EXHAUSTED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case PASS_FAILED ->
                        log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an ingestion event.
     */
    public void logIngestionEvent(IngestionEventType eventType, String message, Map<String, Object> details) {
        Map<String, Object> logData = new HashMap<>();
        logData.put("event", eventType.name());

        if (details != null) {
            logData.putAll(details);
        }

        switch (eventType) {
            case BATCH_ACCEPTED -> log.debug("{} | data={}", message, formatLogData(logData));
            case VALUES_DROPPED -> log.info("{} | data={}", message, formatLogData(logData));
            case MESSAGE_REJECTED -> log.warn("{} | data={}", message, formatLogData(logData));
            default -> log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log a performance metric.
     */
    public void logPerformance(String operation, Duration duration, boolean success,
                               Map<String, Object> details) {
        Map<String, Object> logData = new HashMap<>();
        logData.put("event", "PERFORMANCE");
        logData.put("operation", operation);
        logData.put("durationMs", duration.toMillis());
        logData.put("success", success);

        if (details != null) {
            logData.putAll(details);
        }

        if (duration.toMillis() > 5000) {
            log.warn("Slow operation: {} took {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        } else {
            log.debug("Performance: {} completed in {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum DiscoveryEventType {
        PASS_STARTED, PASS_COMPLETED, PASS_REJECTED, PASS_FAILED, PASS_SUPERSEDED,
        LOW_CONFIDENCE, BUDGET_EXHAUSTED
    }

    public enum IngestionEventType {
        BATCH_ACCEPTED, VALUES_DROPPED, MESSAGE_REJECTED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
