package com.z254.butterfly.drift.scan;

/**
 * Raised when a scan cycle is requested while another one is running.
 */
public class ScanInProgressException extends RuntimeException {

    public ScanInProgressException() {
        super("A scan cycle is already running");
    }
}
