package com.example.driftmonitor.action;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionStatus {
    SUCCESS, FAILED, SKIPPED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
