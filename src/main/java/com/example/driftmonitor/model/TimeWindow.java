package com.example.driftmonitor.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open interval {@code [start, end)}.
 */
@Value
public class TimeWindow {
    Instant start;
    Instant end;

    public TimeWindow(Instant start, Instant end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("Window start must precede end: " + start + " .. " + end);
        }
        this.start = start;
        this.end = end;
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && instant.isBefore(end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }
}
