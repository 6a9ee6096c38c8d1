package com.z254.butterfly.drift.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.butterfly.drift.audit.AuditLogEntryParser;
import com.z254.butterfly.drift.audit.AuditLogException;
import com.z254.butterfly.drift.audit.AuditLogSource;
import com.z254.butterfly.drift.config.DriftProperties;
import com.z254.butterfly.drift.domain.model.AuditLogEntry;
import com.z254.butterfly.drift.domain.model.Provider;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Client for the Azure Activity Log (management events) of a subscription.
 * <p>
 * The API filters on time and resource provider only; resource type, failed
 * operations, ordering and the page bound are applied here.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "drift.audit-log.azure", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AzureActivityLogClient implements AuditLogSource {

    private static final String FAILED_STATUS = "Failed";

    private final WebClient webClient;
    private final DriftProperties.AuditLog config;
    private final CloudAccessTokenProvider tokenProvider;
    private final Clock clock;

    public AzureActivityLogClient(WebClient.Builder webClientBuilder,
                                  DriftProperties driftProperties,
                                  CloudAccessTokenProvider tokenProvider,
                                  Clock clock) {
        this.config = driftProperties.getAuditLog();
        this.tokenProvider = tokenProvider;
        this.clock = clock;
        this.webClient = webClientBuilder
                .baseUrl(config.getAzure().getBaseUrl())
                .build();
    }

    @Override
    public Provider provider() {
        return Provider.AZURE;
    }

    @Override
    @CircuitBreaker(name = "azure-activity-log")
    @Retry(name = "azure-activity-log")
    public Mono<List<AuditLogEntry>> query(String logResourceType, String subscriptionId, Instant since) {
        String filter = buildFilter(logResourceType, since, clock.instant());
        log.debug("Listing Azure activity log: subscription={}, resourceType={}, since={}",
                subscriptionId, logResourceType, since);

        return tokenProvider.azureToken()
                .flatMap(token -> webClient.get()
                        .uri(uriBuilder -> uriBuilder
                                .path("/subscriptions/{subscriptionId}/providers/microsoft.insights/eventtypes/management/values")
                                .queryParam("api-version", config.getAzure().getApiVersion())
                                .queryParam("$filter", "{filter}")
                                .build(subscriptionId, filter))
                        .headers(headers -> headers.setBearerAuth(token))
                        .retrieve()
                        .bodyToMono(JsonNode.class)
                        .timeout(config.getAzure().getTimeout()))
                .map(response -> parseEvents(response, logResourceType))
                .onErrorMap(e -> !(e instanceof AuditLogException),
                        e -> new AuditLogException("Issue listing Azure activity log for subscription "
                                + subscriptionId, e))
                .doOnError(e -> log.warn("Failed to list Azure activity log: subscription={}, error={}",
                        subscriptionId, e.getMessage()));
    }

    static String buildFilter(String logResourceType, Instant since, Instant until) {
        StringBuilder filter = new StringBuilder()
                .append("eventTimestamp ge '").append(since.truncatedTo(ChronoUnit.SECONDS)).append("'")
                .append(" and eventTimestamp le '").append(until.truncatedTo(ChronoUnit.SECONDS)).append("'");
        int slash = logResourceType.indexOf('/');
        if (slash > 0) {
            filter.append(" and resourceProvider eq '").append(logResourceType, 0, slash).append("'");
        }
        return filter.toString();
    }

    private List<AuditLogEntry> parseEvents(JsonNode response, String logResourceType) {
        List<AuditLogEntry> entries = new ArrayList<>();
        for (JsonNode event : response.path("value")) {
            if (FAILED_STATUS.equalsIgnoreCase(event.path("status").path("value").asText())) {
                continue;
            }
            AuditLogEntry entry = AuditLogEntryParser.fromAzureEvent(event);
            if (entry.getResourceType() != null && !entry.getResourceType().equalsIgnoreCase(logResourceType)) {
                continue;
            }
            entries.add(entry);
        }
        entries.sort(Comparator.comparing(AuditLogEntry::getTimestamp,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return entries.size() > config.getPageSize()
                ? new ArrayList<>(entries.subList(0, config.getPageSize()))
                : entries;
    }
}
