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
@Document("task_log")
public class TaskRecord implements LogRecord {
    @Id
    private String id;
    private Instant timestamp;
    @Field("task_type")
    private String taskType;
    @Field("success_flag")
    private boolean successFlag;

    @Override
    public boolean inCategory(String category) {
        return Objects.equals(taskType, category);
    }
}
