package com.example.driftmonitor.decision;

import com.example.driftmonitor.monitor.DriftReport;
import com.example.driftmonitor.monitor.DriftScores;
import com.example.driftmonitor.monitor.accuracy.AccuracyDriftReport;
import com.example.driftmonitor.monitor.behavior.BehaviorDriftReport;
import com.example.driftmonitor.monitor.embedding.EmbeddingDriftReport;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * The three monitor reports of a run. A report is {@code null} when its monitor failed;
 * the failure is listed in {@code monitorErrors}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CombinedDriftReport {
    Instant timestamp;
    EmbeddingDriftReport embeddingDrift;
    BehaviorDriftReport behaviorDrift;
    AccuracyDriftReport accuracyDrift;
    Map<String, String> monitorErrors;
    boolean overallDriftDetected;
    double overallDriftScore;

    public static CombinedDriftReport of(Instant timestamp,
                                         EmbeddingDriftReport embedding,
                                         BehaviorDriftReport behavior,
                                         AccuracyDriftReport accuracy,
                                         Map<String, String> monitorErrors) {
        boolean detected = Stream.of(embedding, behavior, accuracy)
                .anyMatch(r -> r != null && r.isDriftDetected());
        double score = Stream.of(embedding, behavior, accuracy)
                .filter(r -> r != null && r.getDriftScore() != null)
                .mapToDouble(DriftReport::getDriftScore)
                .max()
                .orElse(0.0);
        return new CombinedDriftReport(timestamp, embedding, behavior, accuracy,
                Collections.unmodifiableMap(new LinkedHashMap<>(monitorErrors)), detected, DriftScores.clip(score));
    }

    @JsonIgnore
    public boolean isComplete() {
        return monitorErrors.isEmpty();
    }

    /**
     * Union of the sub-signals of every report that was produced.
     */
    public Map<String, Boolean> signals() {
        Map<String, Boolean> signals = new HashMap<>();
        Stream.of(embeddingDrift, behaviorDrift, accuracyDrift)
                .filter(r -> r != null)
                .forEach(r -> signals.putAll(r.signals()));
        return signals;
    }

    public boolean signal(String name) {
        return Boolean.TRUE.equals(signals().get(name));
    }
}
