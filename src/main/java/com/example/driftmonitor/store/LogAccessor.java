package com.example.driftmonitor.store;

import com.example.driftmonitor.model.LogRecord;

import java.util.List;

/**
 * Read-only access to the interaction, evaluation, task and embedding log streams.
 */
public interface LogAccessor {

    /**
     * Records of {@code query.stream} inside {@code query.window}, ordered by timestamp.
     * Returns an empty list when nothing matches.
     *
     * @throws com.example.driftmonitor.error.DataSourceException when the store cannot be queried
     */
    <T extends LogRecord> List<T> getRecords(LogQuery query, Class<T> type);

    /**
     * Optional streams (tasks) may simply not exist in a deployment.
     */
    boolean streamExists(LogStream stream);
}
