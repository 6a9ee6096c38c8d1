package com.z254.butterfly.drift.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.butterfly.drift.automation.AutomationRunException;
import com.z254.butterfly.drift.config.DriftProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Client for the Terraform Cloud/Enterprise API v2.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "drift.terraform", name = "url")
public class TerraformCloudClient {

    private static final String JSON_API = "application/vnd.api+json";

    private final WebClient webClient;
    private final DriftProperties.Terraform config;

    public TerraformCloudClient(WebClient.Builder webClientBuilder, DriftProperties driftProperties) {
        this.config = driftProperties.getTerraform();
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .defaultHeader("Accept", JSON_API)
                .build();
    }

    /**
     * Resolve a workspace name to its id.
     */
    @CircuitBreaker(name = "terraform")
    @Retry(name = "terraform")
    public Mono<String> workspaceId(String organization, String workspace, String token) {
        log.debug("Getting workspace id: org={}, workspace={}", organization, workspace);
        return webClient.get()
                .uri("/api/v2/organizations/{org}/workspaces/{workspace}", organization, workspace)
                .headers(headers -> headers.setBearerAuth(token))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(response -> {
                    String id = response.path("data").path("id").asText(null);
                    if (id == null) {
                        throw new AutomationRunException("No workspace id in response for workspace " + workspace);
                    }
                    return id;
                })
                .onErrorMap(e -> !(e instanceof AutomationRunException),
                        e -> new AutomationRunException("Issue getting workspace ID for workspace " + workspace, e));
    }

    /**
     * Most recent runs of a workspace including their creator.
     */
    @CircuitBreaker(name = "terraform")
    @Retry(name = "terraform")
    public Mono<JsonNode> listRuns(String workspaceId, int limit, String token) {
        log.debug("Getting {} Terraform runs for workspace id {}", limit, workspaceId);
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v2/workspaces/{workspaceId}/runs")
                        .queryParam("page[size]", limit)
                        .queryParam("include", "created_by")
                        .build(workspaceId))
                .headers(headers -> headers.setBearerAuth(token))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .onErrorMap(e -> !(e instanceof AutomationRunException),
                        e -> new AutomationRunException("Issue getting Terraform runs for workspace " + workspaceId, e));
    }
}
