package com.example.driftmonitor.error;

/**
 * A log query failed or returned rows that cannot be analysed.
 * Never retried inside the pipeline; the orchestrator records the affected monitor as failed.
 */
public class DataSourceException extends DriftMonitorException {

    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
