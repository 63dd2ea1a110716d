package com.example.driftmonitor.store;

import com.example.driftmonitor.error.DataSourceException;
import com.example.driftmonitor.model.LogRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link LogAccessor} over in-memory lists, with the same window, category, order and limit
 * semantics as the Mongo implementation.
 */
public class InMemoryLogAccessor implements LogAccessor {

    private final Map<LogStream, List<LogRecord>> streams = new EnumMap<>(LogStream.class);
    private final Set<LogStream> failing = EnumSet.noneOf(LogStream.class);

    public InMemoryLogAccessor add(LogStream stream, LogRecord record) {
        streams.computeIfAbsent(stream, s -> new ArrayList<>()).add(record);
        return this;
    }

    public InMemoryLogAccessor addAll(LogStream stream, List<? extends LogRecord> records) {
        records.forEach(r -> add(stream, r));
        return this;
    }

    /** Creates the stream without rows, as an existing but empty collection. */
    public InMemoryLogAccessor create(LogStream stream) {
        streams.computeIfAbsent(stream, s -> new ArrayList<>());
        return this;
    }

    public InMemoryLogAccessor failOn(LogStream stream) {
        failing.add(stream);
        return this;
    }

    @Override
    public <T extends LogRecord> List<T> getRecords(LogQuery query, Class<T> type) {
        if (failing.contains(query.getStream())) {
            throw new DataSourceException("Query on " + query.getStream().collection() + " failed: connection refused");
        }
        if (query.getLimit() <= 0) {
            throw new IllegalArgumentException("Row limit must be positive, got " + query.getLimit());
        }
        Comparator<LogRecord> order = Comparator.comparing(LogRecord::getTimestamp);
        return streams.getOrDefault(query.getStream(), List.of()).stream()
                .filter(r -> query.getWindow().contains(r.getTimestamp()))
                .filter(r -> query.getCategory() == null || r.inCategory(query.getCategory()))
                .sorted(query.isNewestFirst() ? order.reversed() : order)
                .limit(query.getLimit())
                .map(type::cast)
                .collect(Collectors.toList());
    }

    @Override
    public boolean streamExists(LogStream stream) {
        return streams.containsKey(stream);
    }
}
