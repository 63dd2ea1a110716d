package com.example.driftmonitor.store;

import com.example.driftmonitor.model.EmbeddingRecord;
import com.example.driftmonitor.model.EvaluationRecord;
import com.example.driftmonitor.model.InteractionRecord;
import com.example.driftmonitor.model.LogRecord;
import com.example.driftmonitor.model.TaskRecord;

public enum LogStream {
    INTERACTIONS("interaction_log", InteractionRecord.class),
    EVALUATIONS("evaluation_log", EvaluationRecord.class),
    TASKS("task_log", TaskRecord.class),
    EMBEDDINGS("embeddings_log", EmbeddingRecord.class);

    private final String collection;
    private final Class<? extends LogRecord> recordType;

    LogStream(String collection, Class<? extends LogRecord> recordType) {
        this.collection = collection;
        this.recordType = recordType;
    }

    public String collection() {
        return collection;
    }

    public Class<? extends LogRecord> recordType() {
        return recordType;
    }
}
