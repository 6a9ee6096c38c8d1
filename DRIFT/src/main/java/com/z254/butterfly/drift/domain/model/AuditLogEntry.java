package com.z254.butterfly.drift.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Audit record that may identify who changed a resource.
 * Any attribute may be null when the upstream record lacks it.
 */
@Value
@Builder
public class AuditLogEntry {

    String resourceName;

    String resourceType;

    /** Email-like identity of the changer */
    String changer;

    /** UTC timestamp of the audited operation */
    Instant timestamp;

    String methodName;

    String requestType;

    public boolean hasChanger() {
        return changer != null && !changer.isBlank();
    }
}
