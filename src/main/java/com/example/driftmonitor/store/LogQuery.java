package com.example.driftmonitor.store;

import com.example.driftmonitor.model.TimeWindow;
import lombok.Builder;
import lombok.Value;

/**
 * A bounded read against one log stream: always a time window, always a row limit.
 */
@Value
@Builder
public class LogQuery {
    LogStream stream;
    TimeWindow window;
    /** Stream-specific category filter, {@code null} for none. */
    String category;
    int limit;
    @Builder.Default
    boolean newestFirst = false;

    public static LogQuery of(LogStream stream, TimeWindow window, int limit) {
        return LogQuery.builder().stream(stream).window(window).limit(limit).build();
    }
}
