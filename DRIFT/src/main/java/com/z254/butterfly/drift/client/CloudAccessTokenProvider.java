package com.z254.butterfly.drift.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.butterfly.drift.audit.AuditLogException;
import com.z254.butterfly.drift.config.DriftProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Bearer tokens for the cloud audit log APIs.
 * <p>
 * A statically configured token wins; otherwise the token is fetched from the
 * instance metadata endpoint (GCE metadata server, Azure IMDS) and cached until
 * shortly before it expires.
 */
@Slf4j
@Component
public class CloudAccessTokenProvider {

    private static final Duration EXPIRY_MARGIN = Duration.ofMinutes(1);
    private static final String GCP = "gcp";
    private static final String AZURE = "azure";

    private final WebClient webClient;
    private final DriftProperties.AuditLog config;
    private final Clock clock;
    private final ConcurrentMap<String, CachedToken> cache = new ConcurrentHashMap<>();

    public CloudAccessTokenProvider(WebClient.Builder webClientBuilder,
                                    DriftProperties driftProperties,
                                    Clock clock) {
        this.webClient = webClientBuilder.build();
        this.config = driftProperties.getAuditLog();
        this.clock = clock;
    }

    public Mono<String> gcpToken() {
        DriftProperties.AuditLog.Gcp gcp = config.getGcp();
        if (hasText(gcp.getAccessToken())) {
            return Mono.just(gcp.getAccessToken());
        }
        return cached(GCP, () -> webClient.get()
                .uri(gcp.getMetadataUrl())
                .header("Metadata-Flavor", "Google")
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(gcp.getTimeout()));
    }

    public Mono<String> azureToken() {
        DriftProperties.AuditLog.Azure azure = config.getAzure();
        if (hasText(azure.getAccessToken())) {
            return Mono.just(azure.getAccessToken());
        }
        return cached(AZURE, () -> webClient.get()
                .uri(UriComponentsBuilder.fromHttpUrl(azure.getMetadataUrl())
                        .queryParam("api-version", "2018-02-01")
                        .queryParam("resource", azure.getResource())
                        .build()
                        .toUri())
                .header("Metadata", "true")
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(azure.getTimeout()));
    }

    private Mono<String> cached(String key, Supplier<Mono<JsonNode>> fetch) {
        CachedToken token = cache.get(key);
        Instant now = clock.instant();
        if (token != null && token.expiresAt().isAfter(now.plus(EXPIRY_MARGIN))) {
            return Mono.just(token.value());
        }
        return fetch.get()
                .map(response -> {
                    String value = response.path("access_token").asText(null);
                    if (value == null) {
                        throw new AuditLogException("Metadata endpoint returned no access token for " + key);
                    }
                    long expiresIn = response.path("expires_in").asLong(300);
                    cache.put(key, new CachedToken(value, now.plusSeconds(expiresIn)));
                    log.debug("Fetched {} access token from metadata endpoint, expires in {}s", key, expiresIn);
                    return value;
                })
                .onErrorMap(e -> !(e instanceof AuditLogException),
                        e -> new AuditLogException("Unable to obtain " + key + " access token", e));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private record CachedToken(String value, Instant expiresAt) {
    }
}
