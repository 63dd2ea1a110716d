package com.example.driftmonitor.action;

import com.example.driftmonitor.decision.DriftAction;
import com.example.driftmonitor.error.ActionExecutionException;

import java.util.Map;

final class Dispatchers {

    private Dispatchers() {
    }

    static Map<String, Object> require(DriftAction action, Map<String, Object> details, String key) {
        if (details == null || !details.containsKey(key)) {
            throw new ActionExecutionException(action, "Runner response for " + action + " is missing '" + key + "'");
        }
        return details;
    }
}
