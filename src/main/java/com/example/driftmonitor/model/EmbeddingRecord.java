package com.example.driftmonitor.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("embeddings_log")
public class EmbeddingRecord implements LogRecord {
    @Id
    private String id;
    private Instant timestamp;
    // query | doc | response
    private String type;
    private List<Double> vector;

    @Override
    public boolean inCategory(String category) {
        return EmbeddingType.ALL.value().equals(category) || category.equals(type);
    }

    public double[] toArray() {
        double[] out = new double[vector == null ? 0 : vector.size()];
        for (int i = 0; i < out.length; i++) {
            Double v = vector.get(i);
            out[i] = v == null ? 0.0 : v;
        }
        return out;
    }
}
