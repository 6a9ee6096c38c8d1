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
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Client for GCP Cloud Logging audit logs.
 * <p>
 * Lists admin activity audit entries ({@code entries:list}) for one project,
 * excluding error responses, newest first, one page only.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "drift.audit-log.gcp", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GcpLoggingClient implements AuditLogSource {

    private static final DateTimeFormatter FILTER_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

    private final WebClient webClient;
    private final DriftProperties.AuditLog config;
    private final CloudAccessTokenProvider tokenProvider;

    public GcpLoggingClient(WebClient.Builder webClientBuilder,
                            DriftProperties driftProperties,
                            CloudAccessTokenProvider tokenProvider) {
        this.config = driftProperties.getAuditLog();
        this.tokenProvider = tokenProvider;
        this.webClient = webClientBuilder
                .baseUrl(config.getGcp().getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public Provider provider() {
        return Provider.GCP;
    }

    @Override
    @CircuitBreaker(name = "gcp-logging")
    @Retry(name = "gcp-logging")
    public Mono<List<AuditLogEntry>> query(String logResourceType, String projectId, Instant since) {
        Map<String, Object> request = Map.of(
                "resourceNames", List.of("projects/" + projectId),
                "filter", buildFilter(logResourceType, since),
                "orderBy", "timestamp desc",
                "pageSize", config.getPageSize());
        log.debug("Listing GCP audit logs: project={}, resourceType={}, since={}",
                projectId, logResourceType, since);

        return tokenProvider.gcpToken()
                .flatMap(token -> webClient.post()
                        .uri("/v2/entries:list")
                        .headers(headers -> headers.setBearerAuth(token))
                        .bodyValue(request)
                        .retrieve()
                        .bodyToMono(JsonNode.class)
                        .timeout(config.getGcp().getTimeout()))
                .map(this::parseEntries)
                .onErrorMap(e -> !(e instanceof AuditLogException),
                        e -> new AuditLogException("Issue listing GCP audit logs for project " + projectId, e))
                .doOnError(e -> log.warn("Failed to list GCP audit logs: project={}, error={}",
                        projectId, e.getMessage()));
    }

    static String buildFilter(String logResourceType, Instant since) {
        String start = FILTER_TIME_FORMAT.format(since.truncatedTo(ChronoUnit.SECONDS));
        return "timestamp>=\"" + start + "\" AND "
                + "logName: \"cloudaudit.googleapis.com\" AND "
                + "logName: \"activity\" AND "
                + "resource.type=\"" + logResourceType + "\" AND "
                + "NOT protoPayload.response.@type=\"type.googleapis.com/error\"";
    }

    private List<AuditLogEntry> parseEntries(JsonNode response) {
        List<AuditLogEntry> entries = new ArrayList<>();
        JsonNode items = response.path("entries");
        for (JsonNode item : items) {
            if (entries.size() >= config.getPageSize()) {
                break;
            }
            entries.add(AuditLogEntryParser.fromGcpEntry(item));
        }
        return entries;
    }
}
