package com.z254.butterfly.drift.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Normalized automation pipeline run used to explain service-account changes.
 */
@Value
@Builder
public class AutomationRun {

    String message;

    String runId;

    RunStatus status;

    /** Apply time, or the error time for errored runs */
    Instant applyTime;

    String organization;

    String workspace;

    public boolean isChangeRelevant() {
        return status != null && status.isChangeRelevant();
    }
}
