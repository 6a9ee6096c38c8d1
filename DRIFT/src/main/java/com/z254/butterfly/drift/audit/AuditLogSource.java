package com.z254.butterfly.drift.audit;

import com.z254.butterfly.drift.domain.model.AuditLogEntry;
import com.z254.butterfly.drift.domain.model.Provider;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Provider-specific source of audit (activity) log entries.
 */
public interface AuditLogSource {

    Provider provider();

    /**
     * Successful change operations on a resource type since the given time,
     * most recent first, bounded to one page.
     *
     * @param logResourceType the provider's audit log resource type
     * @param targetId project or subscription id
     * @param since start of the window (inclusive)
     * @return parsed entries; errors with {@link AuditLogException} on transport or auth failure
     */
    Mono<List<AuditLogEntry>> query(String logResourceType, String targetId, Instant since);
}
