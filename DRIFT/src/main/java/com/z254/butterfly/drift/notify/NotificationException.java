package com.z254.butterfly.drift.notify;

/**
 * Raised when a notifier fails to deliver a change notification.
 */
public class NotificationException extends RuntimeException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
