package com.example.driftmonitor.action;

import com.example.driftmonitor.decision.DriftAction;
import com.example.driftmonitor.model.DriftWindows;

import java.util.Map;

/**
 * Executes exactly one kind of corrective action. A dispatcher makes a single attempt
 * and never retries.
 */
public interface ActionDispatcher {

    DriftAction action();

    /**
     * @return details reported by the action runner
     * @throws com.example.driftmonitor.error.ActionExecutionException when the action failed
     */
    Map<String, Object> dispatch(DriftWindows windows);
}
