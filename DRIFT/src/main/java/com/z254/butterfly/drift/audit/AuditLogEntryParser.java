package com.z254.butterfly.drift.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.butterfly.drift.domain.model.AuditLogEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Defensive conversion of raw audit records into {@link AuditLogEntry}.
 * <p>
 * Missing nested fields become null; a malformed timestamp becomes null with a
 * warning. Parsing never fails for data-shape problems.
 */
@Slf4j
public final class AuditLogEntryParser {

    private AuditLogEntryParser() {
    }

    /**
     * Parse a Cloud Logging {@code LogEntry} carrying an audit log payload.
     */
    public static AuditLogEntry fromGcpEntry(JsonNode entry) {
        JsonNode payload = entry.path("protoPayload");
        String resourceName = text(payload.path("resourceName"));
        return AuditLogEntry.builder()
                .resourceName(resourceName)
                .resourceType(text(entry.path("resource").path("type")))
                .changer(text(payload.path("authenticationInfo").path("principalEmail")))
                .methodName(text(payload.path("methodName")))
                .requestType(text(payload.path("request").path("@type")))
                .timestamp(timestamp(entry.path("timestamp"), resourceName))
                .build();
    }

    /**
     * Parse an Azure Activity Log management event.
     */
    public static AuditLogEntry fromAzureEvent(JsonNode event) {
        String resourceName = text(event.path("resourceId"));
        return AuditLogEntry.builder()
                .resourceName(resourceName)
                .resourceType(text(event.path("resourceType").path("value")))
                .changer(text(event.path("caller")))
                .methodName(text(event.path("operationName").path("value")))
                .requestType(text(event.path("httpRequest").path("method")))
                .timestamp(timestamp(event.path("eventTimestamp"), resourceName))
                .build();
    }

    static Instant parseTimestamp(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(value).toInstant();
        }
    }

    private static Instant timestamp(JsonNode node, String resourceName) {
        String value = text(node);
        if (value == null) {
            log.warn("Missing audit log timestamp for resource '{}'", resourceName);
            return null;
        }
        try {
            return parseTimestamp(value);
        } catch (DateTimeParseException e) {
            log.warn("Issue parsing audit log timestamp '{}' for resource '{}'", value, resourceName);
            return null;
        }
    }

    private static String text(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText() : null;
    }
}
