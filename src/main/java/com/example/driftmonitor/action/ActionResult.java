package com.example.driftmonitor.action;

import com.example.driftmonitor.decision.DriftAction;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one dispatch attempt.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionResult {
    private final DriftAction action;
    private final ActionStatus status;
    private final Map<String, Object> details;
    private final String error;
    private final Instant timestamp;

    private ActionResult(DriftAction action, ActionStatus status, Map<String, Object> details, String error,
                         Instant timestamp) {
        this.action = action;
        this.status = status;
        this.details = details == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.error = error;
        this.timestamp = timestamp;
    }

    public static ActionResult success(DriftAction action, Map<String, Object> details, Instant timestamp) {
        return new ActionResult(action, ActionStatus.SUCCESS, details, null, timestamp);
    }

    public static ActionResult failure(DriftAction action, String error, Instant timestamp) {
        return new ActionResult(action, ActionStatus.FAILED, null, error, timestamp);
    }

    public static ActionResult skipped(DriftAction action, String reason, Instant timestamp) {
        return new ActionResult(action, ActionStatus.SKIPPED, null, reason, timestamp);
    }

    public boolean isSuccess() { return status == ActionStatus.SUCCESS; }
    public DriftAction getAction() { return action; }
    public ActionStatus getStatus() { return status; }
    public Map<String, Object> getDetails() { return details; }
    public String getError() { return error; }
    public Instant getTimestamp() { return timestamp; }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.value());
        if (details != null) map.put("details", details);
        if (error != null) map.put("error", error);
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
