package com.example.driftmonitor.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * The baseline window immediately followed by the current window ending at "now".
 * {@code baseline.end == current.start} always holds.
 */
@Value
public class DriftWindows {
    TimeWindow baseline;
    TimeWindow current;

    public DriftWindows(TimeWindow baseline, TimeWindow current) {
        if (!baseline.getEnd().equals(current.getStart())) {
            throw new IllegalArgumentException("Baseline window must end where the current window starts");
        }
        this.baseline = baseline;
        this.current = current;
    }

    public static DriftWindows endingAt(Instant now, int baselineDays, int currentDays) {
        Instant currentStart = now.minus(Duration.ofDays(currentDays));
        Instant baselineStart = currentStart.minus(Duration.ofDays(baselineDays));
        return new DriftWindows(new TimeWindow(baselineStart, currentStart), new TimeWindow(currentStart, now));
    }
}
