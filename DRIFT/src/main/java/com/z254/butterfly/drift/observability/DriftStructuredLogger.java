package com.z254.butterfly.drift.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for DRIFT service.
 * <p>
 * Emits {@code message | data={...}} lines and manages the MDC keys that
 * correlate log lines of one batch and one change.
 */
@Slf4j
@Component
public class DriftStructuredLogger {

    // MDC keys
    public static final String MDC_BATCH_ID = "batchId";
    public static final String MDC_CHANGE_FILE = "changeFile";
    public static final String MDC_PROVIDER = "provider";

    /**
     * Log a change attribution event.
     */
    public void logChangeEvent(ChangeEventType eventType, String message, Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", eventType.name());
        if (details != null) {
            logData.putAll(details);
        }

        switch (eventType) {
            case AUDIT_LOG_FAILED, AUTOMATION_LOOKUP_FAILED, NOTIFICATION_FAILED, UNATTRIBUTED ->
                    log.warn("{} | data={}", message, formatLogData(logData));
            case BATCH_FAILED -> log.error("{} | data={}", message, formatLogData(logData));
            case SKIPPED -> log.debug("{} | data={}", message, formatLogData(logData));
            default -> log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    public MDCScope withBatchId(String batchId) {
        MDC.put(MDC_BATCH_ID, batchId);
        return new MDCScope(MDC_BATCH_ID);
    }

    private String formatLogData(Map<String, Object> data) {
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

    public enum ChangeEventType {
        BATCH_STARTED, BATCH_COMPLETED, BATCH_FAILED,
        SKIPPED, ATTRIBUTED, UNATTRIBUTED, COMMITTED,
        AUDIT_LOG_FAILED, AUTOMATION_LOOKUP_FAILED, NOTIFICATION_FAILED,
        PUSHED
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
