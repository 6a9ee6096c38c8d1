package com.z254.butterfly.drift.automation;

/**
 * Raised when automation runs cannot be retrieved for a changer.
 */
public class AutomationRunException extends RuntimeException {

    public AutomationRunException(String message) {
        super(message);
    }

    public AutomationRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
