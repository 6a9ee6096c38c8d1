package com.z254.butterfly.drift.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.butterfly.drift.config.DriftProperties;
import com.z254.butterfly.drift.domain.model.Change;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Posts committed changes to a Slack channel.
 * <p>
 * The diff is uploaded as a file; the comment carries the commit message,
 * a manual change warning and a link to the commit.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "drift.slack", name = "enabled", havingValue = "true")
public class SlackNotifier implements ChangeNotifier {

    static final String MANUAL_CHANGE_HEADER = ":warning: *MANUAL CHANGE* :warning:";
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final WebClient webClient;
    private final DriftProperties.Slack config;

    public SlackNotifier(WebClient.Builder webClientBuilder, DriftProperties driftProperties) {
        this.config = driftProperties.getSlack();
        if (config.getToken() == null || config.getChannelId() == null) {
            throw new IllegalStateException("Slack notifications need drift.slack.token and drift.slack.channel-id");
        }
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .build();
    }

    @Override
    public String name() {
        return "slack";
    }

    @Override
    @CircuitBreaker(name = "slack")
    @Retry(name = "slack")
    public void post(Change change) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("channels", config.getChannelId());
        body.part("title", change.filePath());
        body.part("content", change.getDiff() != null ? change.getDiff() : "");
        body.part("initial_comment", buildComment(change));

        JsonNode response;
        try {
            response = webClient.post()
                    .uri("/files.upload")
                    .headers(headers -> headers.setBearerAuth(config.getToken()))
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(body.build()))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(TIMEOUT)
                    .block();
        } catch (RuntimeException e) {
            throw new NotificationException("Issue posting to Slack channel", e);
        }
        if (response == null || !response.path("ok").asBoolean(false)) {
            String error = response != null ? response.path("error").asText("unknown") : "empty response";
            throw new NotificationException("Issue posting to Slack channel: " + error);
        }
        log.info("Posted change {} to Slack channel {}", change.filePath(), config.getChannelId());
    }

    String buildComment(Change change) {
        StringBuilder comment = new StringBuilder();
        if (change.isManual()) {
            comment.append(MANUAL_CHANGE_HEADER).append('\n');
        }
        comment.append(change.getMessage()).append('\n');
        if (change.getCommitId() != null) {
            comment.append("Commit: ").append(config.getRepoCommitUrl()).append('/').append(change.getCommitId()).append('\n');
        } else {
            comment.append("Unknown commit ID: ").append(config.getRepoCommitUrl()).append('\n');
        }
        return comment.toString();
    }
}
