package com.example.driftmonitor.monitor;

import com.example.driftmonitor.model.TimeWindow;
import lombok.Value;

import java.time.Instant;

@Value
public class PeriodSummary<M> {
    Instant start;
    Instant end;
    int sampleCount;
    M metrics;

    public static <M> PeriodSummary<M> of(TimeWindow window, int sampleCount, M metrics) {
        return new PeriodSummary<>(window.getStart(), window.getEnd(), sampleCount, metrics);
    }
}
