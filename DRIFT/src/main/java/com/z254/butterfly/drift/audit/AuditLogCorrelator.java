package com.z254.butterfly.drift.audit;

import com.z254.butterfly.drift.config.DriftProperties;
import com.z254.butterfly.drift.domain.model.AuditLogEntry;
import com.z254.butterfly.drift.domain.model.Change;
import com.z254.butterfly.drift.domain.model.Provider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Finds the audit log entries that may explain a drifted snapshot.
 * <p>
 * Sources are registered per provider from the available {@link AuditLogSource}
 * beans; a provider without a source fails the lookup like a transport error.
 */
@Slf4j
@Component
public class AuditLogCorrelator {

    private final Map<Provider, AuditLogSource> sources = new EnumMap<>(Provider.class);
    private final DriftProperties.AuditLog config;

    @Autowired
    public AuditLogCorrelator(ObjectProvider<AuditLogSource> auditLogSources, DriftProperties driftProperties) {
        this(auditLogSources.orderedStream().toList(), driftProperties);
    }

    AuditLogCorrelator(List<AuditLogSource> auditLogSources, DriftProperties driftProperties) {
        this.config = driftProperties.getAuditLog();
        for (AuditLogSource source : auditLogSources) {
            AuditLogSource previous = sources.put(source.provider(), source);
            if (previous != null) {
                throw new IllegalStateException("Duplicate audit log source for provider " + source.provider());
            }
        }
        log.info("Audit log sources registered: {}", sources.keySet());
    }

    /**
     * Audit entries for the change's resource type within the window before
     * the reference time, most recent first.
     *
     * @throws AuditLogException when the source is missing or cannot be reached
     */
    public List<AuditLogEntry> correlate(Change change, Instant referenceTime, int windowMinutes) {
        AuditLogSource source = sources.get(change.getProvider());
        if (source == null) {
            throw new AuditLogException("No audit log source configured for provider " + change.getProvider());
        }
        Instant since = referenceTime.minus(Duration.ofMinutes(windowMinutes));
        String logResourceType = config.logResourceTypeFor(change.getResourceType());

        List<AuditLogEntry> entries;
        try {
            entries = source.query(logResourceType, change.getProjectId(), since).block();
        } catch (AuditLogException e) {
            throw e;
        } catch (RuntimeException e) {
            // open circuit breaker or an unmapped reactor error
            throw new AuditLogException("Issue querying " + change.getProvider() + " audit logs for "
                    + change.getProjectId(), e);
        }
        if (entries == null) {
            return Collections.emptyList();
        }
        log.debug("Found {} audit log entries: provider={}, resourceType={}, project={}",
                entries.size(), change.getProvider(), logResourceType, change.getProjectId());
        return entries;
    }
}
