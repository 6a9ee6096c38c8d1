package com.z254.butterfly.drift.automation;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.butterfly.drift.domain.model.AutomationRun;
import com.z254.butterfly.drift.domain.model.RunStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts a Terraform runs list response into {@link AutomationRun} records.
 * <p>
 * Only applied and errored runs are kept. The apply time is taken from
 * {@code status-timestamps.applying-at}; errored runs that never reached the
 * apply phase use {@code errored-at}. Runs without a usable timestamp are
 * dropped with a warning.
 */
@Slf4j
public final class AutomationRunParser {

    private static final String APPLYING_AT = "applying-at";
    private static final String ERRORED_AT = "errored-at";

    private AutomationRunParser() {
    }

    public static List<AutomationRun> parse(JsonNode runsResponse, String organization, String workspace) {
        if (runsResponse == null || !runsResponse.has("data")) {
            throw new AutomationRunException("No 'data' in Terraform run response");
        }
        List<AutomationRun> runs = new ArrayList<>();
        for (JsonNode run : runsResponse.path("data")) {
            JsonNode attributes = run.path("attributes");
            JsonNode statusNode = attributes.path("status");
            if (!statusNode.isTextual()) {
                log.warn("No status field for Terraform run {}", run.path("id").asText("<unknown>"));
                continue;
            }
            RunStatus status = RunStatus.fromValue(statusNode.asText());
            if (!status.isChangeRelevant()) {
                continue;
            }
            Instant applyTime = applyTime(run, attributes.path("status-timestamps"), status);
            if (applyTime == null) {
                continue;
            }
            runs.add(AutomationRun.builder()
                    .message(attributes.path("message").isTextual() ? attributes.path("message").asText() : null)
                    .runId(run.path("id").isTextual() ? run.path("id").asText() : null)
                    .status(status)
                    .applyTime(applyTime)
                    .organization(organization)
                    .workspace(workspace)
                    .build());
        }
        return runs;
    }

    private static Instant applyTime(JsonNode run, JsonNode timestamps, RunStatus status) {
        String value = timestamps.path(APPLYING_AT).asText(null);
        if (value == null && status == RunStatus.ERRORED) {
            value = timestamps.path(ERRORED_AT).asText(null);
        }
        if (value == null) {
            log.warn("No status-timestamps field for Terraform run {}", run.path("id").asText("<unknown>"));
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Issue parsing Terraform run timestamp '{}' for run {}", value, run.path("id").asText("<unknown>"));
            return null;
        }
    }
}
