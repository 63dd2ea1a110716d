package com.example.driftmonitor.metrics;

import com.example.driftmonitor.decision.CombinedDriftReport;

/**
 * Sink for drift gauges and action counters. Implementations must tolerate concurrent callers.
 */
public interface MetricsExporter {

    /**
     * Sets every drift gauge the report carries a value for; gauges of failed monitors keep their last value.
     */
    void publish(CombinedDriftReport report);

    void recordRetrain();

    void recordReindex();

    void addApiCost(double usd);
}
