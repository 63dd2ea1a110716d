package com.example.driftmonitor.service;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
public class PipelineEvent {

    public static final String PIPELINE_STARTED = "pipeline_started";
    public static final String MONITOR_FAILED = "monitor_failed";
    public static final String DETECTION_COMPLETE = "drift_detection_complete";
    public static final String NO_ACTION = "no_action";
    public static final String ACTIONS_EXECUTED = "actions_executed";
    public static final String RUN_CANCELLED = "run_cancelled";
    public static final String PIPELINE_COMPLETE = "pipeline_complete";

    Instant timestamp;
    String eventType;
    Map<String, Object> details;
}
