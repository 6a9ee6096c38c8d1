package com.z254.butterfly.drift.automation;

/**
 * Raised when no Terraform organization/workspace is configured for a changer login.
 */
public class UnknownChangerException extends AutomationRunException {

    public UnknownChangerException(String login) {
        super("Unknown service account " + login);
    }
}
