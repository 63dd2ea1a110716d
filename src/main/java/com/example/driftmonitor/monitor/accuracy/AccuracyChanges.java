package com.example.driftmonitor.monitor.accuracy;

import lombok.Builder;
import lombok.Value;

/**
 * Each drop is {@code null} when either period had no qualifying records.
 */
@Value
@Builder
public class AccuracyChanges {
    Double accuracyDrop;
    boolean accuracyDriftDetected;
    /** {@code (baseline - current) / baseline} of the average rating, as a fraction. */
    Double feedbackDropPct;
    boolean feedbackDriftDetected;
    Double taskSuccessDrop;
    boolean taskDriftDetected;
}
