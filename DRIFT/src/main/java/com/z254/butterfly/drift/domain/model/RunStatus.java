package com.z254.butterfly.drift.domain.model;

import java.util.Locale;

/**
 * Status of an automation (Terraform) run.
 * Only {@link #APPLIED} and {@link #ERRORED} runs can have changed infrastructure.
 */
public enum RunStatus {
    PENDING,
    PLANNING,
    PLANNED,
    PLANNED_AND_FINISHED,
    APPLY_QUEUED,
    APPLYING,
    APPLIED,
    DISCARDED,
    ERRORED,
    CANCELED,
    FORCE_CANCELED,
    OTHER;

    public boolean isChangeRelevant() {
        return this == APPLIED || this == ERRORED;
    }

    public static RunStatus fromValue(String value) {
        if (value == null) {
            return OTHER;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
