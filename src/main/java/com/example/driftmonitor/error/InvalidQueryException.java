package com.example.driftmonitor.error;

/**
 * A caller supplied query parameter outside its allowed range.
 */
public class InvalidQueryException extends DriftMonitorException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
