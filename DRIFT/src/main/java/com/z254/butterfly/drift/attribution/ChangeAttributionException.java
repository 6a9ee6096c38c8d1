package com.z254.butterfly.drift.attribution;

/**
 * Fatal attribution failure that aborts the remaining batch.
 */
public class ChangeAttributionException extends RuntimeException {

    public ChangeAttributionException(String message) {
        super(message);
    }

    public ChangeAttributionException(String message, Throwable cause) {
        super(message, cause);
    }
}
