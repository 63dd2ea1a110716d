package com.example.driftmonitor.monitor;

import java.util.Map;

/**
 * Verdict of one monitor for one run. Immutable once built.
 */
public interface DriftReport {

    boolean isDriftDetected();

    /**
     * Score clipped to [0, 1]; {@code null} when the monitor could not compute one.
     */
    Double getDriftScore();

    boolean isInsufficientData();

    /**
     * Human readable reason for a missing verdict, {@code null} otherwise.
     */
    String getError();

    /**
     * Named boolean sub-signals consumed by the decision engine.
     */
    Map<String, Boolean> signals();
}
