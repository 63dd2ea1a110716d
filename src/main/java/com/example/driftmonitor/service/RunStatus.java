package com.example.driftmonitor.service;

public enum RunStatus {
    /** Every monitor reported and none detected drift. */
    NO_DRIFT,
    /** At least one monitor failed and no action was planned. */
    DETECTION_INCOMPLETE,
    /** Drift was detected but no rule maps it to an action. */
    DRIFT_NO_ACTION,
    DRIFT_ACTIONED,
    /** At least one planned action failed. */
    DRIFT_PARTIALLY_ACTIONED,
    CANCELLED
}
