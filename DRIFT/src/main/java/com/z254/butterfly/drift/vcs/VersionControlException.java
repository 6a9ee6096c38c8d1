package com.z254.butterfly.drift.vcs;

/**
 * Raised when a git operation on the snapshot working tree fails.
 */
public class VersionControlException extends RuntimeException {

    public VersionControlException(String message) {
        super(message);
    }

    public VersionControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
