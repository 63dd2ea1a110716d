package com.example.driftmonitor.decision;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DriftAction {
    REINDEX_DOCUMENTS("reindex_documents"),
    FINE_TUNE_MODEL("fine_tune_model"),
    UPDATE_SAFETY_FILTERS("update_safety_filters");

    private final String value;

    DriftAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
