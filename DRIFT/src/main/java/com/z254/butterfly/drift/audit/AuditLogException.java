package com.z254.butterfly.drift.audit;

/**
 * Raised when an audit log source cannot be reached or rejects the request.
 */
public class AuditLogException extends RuntimeException {

    public AuditLogException(String message) {
        super(message);
    }

    public AuditLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
