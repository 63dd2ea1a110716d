package com.example.driftmonitor.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary row written once per pipeline run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("drift_events")
public class DriftEvent {
    @Id
    private String runId;
    private Instant timestamp;
    private String status;
    @Field("drift_score")
    private double driftScore;
    @Field("actions_taken")
    private List<String> actionsTaken;
    private Map<String, Object> details;
}
