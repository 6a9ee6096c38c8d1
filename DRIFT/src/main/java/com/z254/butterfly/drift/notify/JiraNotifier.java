package com.z254.butterfly.drift.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.butterfly.drift.config.DriftProperties;
import com.z254.butterfly.drift.domain.model.Change;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Opens a Jira issue for every manual change.
 * <p>
 * Changes of projects not matching the optional project id filter are ignored.
 * The issue is assigned to the first changer Jira accepts as assignee.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "drift.jira", name = "enabled", havingValue = "true")
public class JiraNotifier implements ChangeNotifier {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final WebClient webClient;
    private final DriftProperties.Jira config;
    private final Pattern projectIdFilter;

    public JiraNotifier(WebClient.Builder webClientBuilder, DriftProperties driftProperties) {
        this.config = driftProperties.getJira();
        if (config.getUrl() == null || config.getProjectKey() == null) {
            throw new IllegalStateException("Jira notifications need drift.jira.url and drift.jira.project-key");
        }
        if (config.getUsername() == null || config.getToken() == null) {
            throw new IllegalStateException("Missing Jira username/token credentials");
        }
        this.projectIdFilter = config.getProjectIdFilter() != null
                ? Pattern.compile(config.getProjectIdFilter())
                : null;
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .defaultHeaders(headers -> headers.setBasicAuth(config.getUsername(), config.getToken()))
                .build();
    }

    @Override
    public String name() {
        return "jira";
    }

    @Override
    @CircuitBreaker(name = "jira")
    @Retry(name = "jira")
    public void post(Change change) {
        if (!change.isManual()) {
            log.info("Skipping ticket creation for non-manual change {}", change.filePath());
            return;
        }
        if (projectIdFilter != null && !projectIdFilter.matcher(change.getProjectId()).lookingAt()) {
            log.info("Skipping ticket creation for non-matching project id {}", change.getProjectId());
            return;
        }

        String issueKey = createIssue(change);
        log.info("Created Jira issue {} for change {}", issueKey, change.filePath());
        for (String changer : change.getChangers()) {
            if (assign(issueKey, changer)) {
                break;
            }
        }
    }

    private String createIssue(Change change) {
        Map<String, Object> fields = new HashMap<>(config.getFields());
        fields.put("project", Map.of("key", config.getProjectKey()));
        fields.put("summary", summary(change));
        fields.put("description", description(change));
        fields.put("issuetype", Map.of("name", config.getIssueType()));

        JsonNode response;
        try {
            response = webClient.post()
                    .uri("/rest/api/2/issue")
                    .bodyValue(Map.of("fields", fields))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(TIMEOUT)
                    .block();
        } catch (RuntimeException e) {
            throw new NotificationException("Issue creating ticket", e);
        }
        String key = response != null ? response.path("key").asText(null) : null;
        if (key == null) {
            throw new NotificationException("Issue creating ticket: no issue key in response");
        }
        return key;
    }

    private boolean assign(String issueKey, String changer) {
        try {
            log.info("Assigning issue {} to user {}", issueKey, changer);
            webClient.put()
                    .uri("/rest/api/2/issue/{key}/assignee", issueKey)
                    .bodyValue(Map.of("name", changer))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(TIMEOUT)
                    .block();
            return true;
        } catch (RuntimeException e) {
            log.warn("Unable to assign ticket {} to changer {}: {}", issueKey, changer, e.getMessage());
            return false;
        }
    }

    static String summary(Change change) {
        return change.getProvider().name() + " manual change detected - project: " + change.getProjectId()
                + ", resource: " + change.getResourceType();
    }

    static String description(Change change) {
        List<String> changers = change.getChangers();
        String changer;
        if (changers.isEmpty()) {
            changer = "Unknown changer";
        } else if (changers.size() == 1) {
            changer = changers.get(0);
        } else {
            changer = String.join(", ", changers);
        }
        return "Manual changes performed by " + changer + "\n\n"
                + "{code:java}\n" + (change.getDiff() != null ? change.getDiff() : "") + "\n{code}\n";
    }
}
