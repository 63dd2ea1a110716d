package com.example.driftmonitor.error;

import com.example.driftmonitor.decision.DriftAction;

public class ActionExecutionException extends DriftMonitorException {

    private final DriftAction action;

    public ActionExecutionException(DriftAction action, String message) {
        super(message);
        this.action = action;
    }

    public ActionExecutionException(DriftAction action, String message, Throwable cause) {
        super(message, cause);
        this.action = action;
    }

    public DriftAction getAction() {
        return action;
    }
}
