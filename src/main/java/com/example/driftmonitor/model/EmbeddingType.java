package com.example.driftmonitor.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EmbeddingType {
    QUERY("query"),
    DOC("doc"),
    ALL("all");

    private final String value;

    EmbeddingType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static EmbeddingType fromValue(String value) {
        for (EmbeddingType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown embedding type: " + value);
    }
}
