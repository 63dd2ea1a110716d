package com.example.driftmonitor.monitor.accuracy;

import lombok.Value;

@Value
public class AccuracyPeriodMetrics {
    EvaluationMetrics evaluationMetrics;
    FeedbackMetrics feedbackMetrics;
    TaskMetrics taskMetrics;
}
