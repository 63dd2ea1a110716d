package com.example.driftmonitor.model;

import java.time.Instant;

/**
 * A row of one of the read-only log streams.
 */
public interface LogRecord {

    Instant getTimestamp();

    /**
     * Whether this record belongs to the given stream-specific category
     * (embedding type, interaction flag, evaluation set).
     */
    boolean inCategory(String category);
}
