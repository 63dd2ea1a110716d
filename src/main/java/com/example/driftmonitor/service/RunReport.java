package com.example.driftmonitor.service;

import com.example.driftmonitor.action.ActionResult;
import com.example.driftmonitor.decision.CombinedDriftReport;
import com.example.driftmonitor.decision.DriftAction;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The persisted audit record of one run. Serialized once, never rewritten.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunReport {
    String runId;
    Instant startTime;
    Instant endTime;
    double durationSeconds;
    RunStatus status;
    /** {@code null} when the run was cancelled before detection finished. */
    CombinedDriftReport driftReport;
    List<DriftAction> actionsTaken;
    /** Keyed by action wire name. */
    Map<String, ActionResult> actionResults;
    List<PipelineEvent> events;
}
