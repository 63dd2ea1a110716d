package com.example.driftmonitor.monitor.behavior;

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
public class BehaviorDriftReport implements DriftReport {

    public static final String REFUSAL_SIGNAL = "refusal_drift";
    public static final String TOXICITY_SIGNAL = "toxicity_drift";
    public static final String ERROR_SIGNAL = "error_drift";
    public static final String LENGTH_SIGNAL = "length_anomaly";

    Instant timestamp;
    PeriodSummary<BehaviorMetrics> baselinePeriod;
    PeriodSummary<BehaviorMetrics> currentPeriod;
    boolean driftDetected;
    Double driftScore;
    boolean insufficientData;
    String error;
    Integer baselineInteractions;
    Integer currentInteractions;
    BehaviorChanges changes;
    Map<String, Double> thresholds;

    @Override
    public Map<String, Boolean> signals() {
        if (changes == null) {
            return Map.of(REFUSAL_SIGNAL, false, TOXICITY_SIGNAL, false, ERROR_SIGNAL, false, LENGTH_SIGNAL, false);
        }
        return Map.of(
                REFUSAL_SIGNAL, changes.isRefusalDriftDetected(),
                TOXICITY_SIGNAL, changes.isToxicityDriftDetected(),
                ERROR_SIGNAL, changes.isErrorDriftDetected(),
                LENGTH_SIGNAL, changes.isLengthAnomalyDetected());
    }
}
