package com.z254.butterfly.drift.automation;

import com.z254.butterfly.drift.domain.model.AutomationRun;

import java.time.Instant;
import java.util.List;

/**
 * Source of automation pipeline runs explaining service account changes.
 */
public interface AutomationRunSource {

    /**
     * Change-relevant runs of the workspaces mapped to a changer login that
     * started applying at or after {@code referenceTime - windowMinutes}.
     *
     * @throws UnknownChangerException when no workspace is configured for the login
     * @throws AutomationRunException on any other lookup failure
     */
    List<AutomationRun> runsFor(String login, Instant referenceTime, int windowMinutes);

    /**
     * Browser URL of a run.
     */
    String runUrl(AutomationRun run);
}
