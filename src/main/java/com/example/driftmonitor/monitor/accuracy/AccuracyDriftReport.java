package com.example.driftmonitor.monitor.accuracy;

import com.example.driftmonitor.monitor.DriftReport;
import com.example.driftmonitor.monitor.PeriodSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccuracyDriftReport implements DriftReport {

    public static final String SIGNAL = "accuracy_drift";

    Instant timestamp;
    PeriodSummary<AccuracyPeriodMetrics> baselinePeriod;
    PeriodSummary<AccuracyPeriodMetrics> currentPeriod;
    boolean driftDetected;
    Double driftScore;
    boolean insufficientData;
    String error;
    AccuracyChanges changes;
    Map<String, Double> thresholds;

    @Override
    public Map<String, Boolean> signals() {
        return Map.of(SIGNAL, driftDetected);
    }
}
