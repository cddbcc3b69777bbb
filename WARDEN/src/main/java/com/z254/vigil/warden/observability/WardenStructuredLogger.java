package com.z254.vigil.warden.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging for pipeline, gateway and memory decisions.
 * <p>
 * Every line carries an {@code event} discriminator plus a flat JSON payload, and the
 * identifiers involved are placed in MDC for the duration of the call.
 */
@Slf4j
@Component
public class WardenStructuredLogger {

    public static final String MDC_INCIDENT_ID = "incidentId";
    public static final String MDC_INTENT_ID = "intentId";
    public static final String MDC_COMPONENT = "component";

    public void logPipelineEvent(String incidentId, String component, PipelineEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_INCIDENT_ID, nullToEmpty(incidentId),
                MDC_COMPONENT, nullToEmpty(component)))) {

            Map<String, Object> logData = payload(eventType.name(), details);
            logData.put("incidentId", incidentId);
            logData.put("component", component);

            switch (eventType) {
                case EVENT_REJECTED, ANALYSIS_DEGRADED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case EVENT_CLASSIFIED ->
                        log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    public void logGatewayEvent(String intentId, String component, GatewayEventType eventType,
                                String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_INTENT_ID, nullToEmpty(intentId),
                MDC_COMPONENT, nullToEmpty(component)))) {

            Map<String, Object> logData = payload(eventType.name(), details);
            logData.put("intentId", intentId);
            logData.put("component", component);

            switch (eventType) {
                case FAILED ->
                        log.error("{} | data={}", message, formatLogData(logData));
                case DENIED, REJECTED, EXPIRED, DUPLICATE ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    public void logMemoryEvent(String incidentId, MemoryEventType eventType, String message,
                               Map<String, Object> details) {
        Map<String, Object> logData = payload(eventType.name(), details);
        logData.put("incidentId", incidentId);

        switch (eventType) {
            case UNAVAILABLE, OUTCOME_FAILED ->
                    log.warn("{} | data={}", message, formatLogData(logData));
            default -> log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private Map<String, Object> payload(String event, Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", event);
        if (details != null) {
            logData.putAll(details);
        }
        return logData;
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

    private static String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    // ========== Event Type Enums ==========

    public enum PipelineEventType {
        EVENT_REJECTED, EVENT_CLASSIFIED, ANALYSIS_DEGRADED, INTENTS_EMITTED, COMPLETED
    }

    public enum GatewayEventType {
        DENIED, ADVISORY_ONLY, PENDING_APPROVAL, APPROVED, REJECTED, EXPIRED,
        EXECUTING, COMPLETED, FAILED, DUPLICATE
    }

    public enum MemoryEventType {
        OUTCOME_STORED, OUTCOME_FAILED, UNAVAILABLE
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
