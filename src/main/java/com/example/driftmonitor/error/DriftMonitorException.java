package com.example.driftmonitor.error;

/**
 * Root of the drift monitor's failure taxonomy.
 */
public class DriftMonitorException extends RuntimeException {

    public DriftMonitorException(String message) {
        super(message);
    }

    public DriftMonitorException(String message, Throwable cause) {
        super(message, cause);
    }
}
