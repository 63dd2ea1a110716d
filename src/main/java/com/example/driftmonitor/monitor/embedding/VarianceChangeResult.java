package com.example.driftmonitor.monitor.embedding;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class VarianceChangeResult {
    double baselineVariance;
    double currentVariance;
    /** {@code |current - baseline| / (baseline + eps)} as a fraction. */
    double varianceChange;
    double threshold;
    boolean driftDetected;

    public double getVarianceChangePct() {
        return varianceChange * 100.0;
    }
}
