package com.example.driftmonitor.monitor.accuracy;

import com.example.driftmonitor.model.TaskRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskMetrics {
    /** False when the deployment has no task stream at all. */
    boolean available;
    int totalTasks;
    int successfulTasks;
    Double successRate;

    public static TaskMetrics unavailable() {
        return TaskMetrics.builder().available(false).build();
    }

    public static TaskMetrics of(List<TaskRecord> tasks) {
        int successful = (int) tasks.stream().filter(TaskRecord::isSuccessFlag).count();
        return TaskMetrics.builder()
                .available(true)
                .totalTasks(tasks.size())
                .successfulTasks(successful)
                .successRate(tasks.isEmpty() ? null : (double) successful / tasks.size())
                .build();
    }
}
