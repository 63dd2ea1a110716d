package com.example.driftmonitor.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Objects;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("evaluation_log")
public class EvaluationRecord implements LogRecord {
    @Id
    private String id;
    private Instant timestamp;
    @Field("evaluation_set_name")
    private String evaluationSetName;
    private Double accuracy;
    private Double precision;
    private Double recall;
    @Field("f1_score")
    private Double f1Score;

    @Override
    public boolean inCategory(String category) {
        return Objects.equals(evaluationSetName, category);
    }
}
