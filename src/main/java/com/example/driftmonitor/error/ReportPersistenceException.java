package com.example.driftmonitor.error;

public class ReportPersistenceException extends DriftMonitorException {

    public ReportPersistenceException(String message) {
        super(message);
    }

    public ReportPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
