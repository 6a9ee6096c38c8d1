package com.z254.butterfly.drift.automation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.drift.client.TerraformCloudClient;
import com.z254.butterfly.drift.config.DriftProperties;
import com.z254.butterfly.drift.domain.model.AutomationRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the Terraform runs that may have produced a service account change.
 * <p>
 * Each service account login maps to one organization and one or more
 * workspaces. A failure on any workspace aborts the lookup for the login.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "drift.terraform", name = "url")
public class AutomationRunCorrelator implements AutomationRunSource {

    private final TerraformCloudClient client;
    private final DriftProperties.Terraform config;
    private final Map<String, String> orgTokens;

    public AutomationRunCorrelator(TerraformCloudClient client,
                                   DriftProperties driftProperties,
                                   ObjectMapper objectMapper) {
        this.client = client;
        this.config = driftProperties.getTerraform();
        this.orgTokens = loadTokens(config, objectMapper);
        log.info("Terraform run lookup enabled: url={}, serviceAccounts={}, organizations={}",
                config.getUrl(), config.getServiceAccounts().keySet(), orgTokens.keySet());
    }

    @Override
    public List<AutomationRun> runsFor(String login, Instant referenceTime, int windowMinutes) {
        DriftProperties.Terraform.WorkspaceMapping mapping = config.getServiceAccounts().get(login);
        if (mapping == null) {
            throw new UnknownChangerException(login);
        }
        String organization = mapping.getOrg();
        String token = orgTokens.get(organization);
        if (token == null) {
            throw new AutomationRunException("No Terraform token configured for organization " + organization);
        }

        log.info("Getting last {} Terraform runs for workspaces of {}", config.getRunLimit(), login);
        List<AutomationRun> runs = new ArrayList<>();
        for (String workspace : mapping.getWorkspaces()) {
            JsonNode response = block(client.workspaceId(organization, workspace, token)
                    .flatMap(workspaceId -> client.listRuns(workspaceId, config.getRunLimit(), token)), workspace);
            runs.addAll(AutomationRunParser.parse(response, organization, workspace));
        }

        Instant windowStart = referenceTime.minus(Duration.ofMinutes(windowMinutes));
        List<AutomationRun> relevant = runs.stream()
                .filter(AutomationRun::isChangeRelevant)
                .filter(run -> !run.getApplyTime().isBefore(windowStart))
                .toList();
        log.debug("Terraform runs for {}: fetched={}, relevant={}", login, runs.size(), relevant.size());
        return relevant;
    }

    @Override
    public String runUrl(AutomationRun run) {
        return stripTrailingSlash(config.getUrl()) + "/app/" + run.getOrganization()
                + "/workspaces/" + run.getWorkspace() + "/runs/" + run.getRunId();
    }

    private static JsonNode block(Mono<JsonNode> call, String workspace) {
        try {
            return call.block();
        } catch (AutomationRunException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AutomationRunException("Issue getting Terraform runs for workspace " + workspace, e);
        }
    }

    static Map<String, String> loadTokens(DriftProperties.Terraform config, ObjectMapper objectMapper) {
        Map<String, String> tokens = new HashMap<>(config.getOrgTokens());
        String tokenFile = config.getTokenFile();
        if (tokenFile != null && !tokenFile.isBlank()) {
            try {
                tokens.putAll(objectMapper.readValue(Path.of(tokenFile).toFile(),
                        new TypeReference<Map<String, String>>() { }));
            } catch (IOException e) {
                throw new IllegalStateException("Issue opening Terraform token file " + tokenFile, e);
            }
        }
        return tokens;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
