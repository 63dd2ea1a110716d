package com.example.driftmonitor.monitor.behavior;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BehaviorChanges {
    double refusalRateChange;
    boolean refusalDriftDetected;
    double toxicityRateChange;
    boolean toxicityDriftDetected;
    double errorRateChange;
    boolean errorDriftDetected;
    /** Relative change of the average response length, as a fraction. */
    double responseLengthChange;
    boolean lengthAnomalyDetected;

    public double getResponseLengthChangePct() {
        return responseLengthChange * 100.0;
    }
}
