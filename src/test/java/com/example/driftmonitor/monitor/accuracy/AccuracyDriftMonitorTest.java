package com.example.driftmonitor.monitor.accuracy;

import com.example.driftmonitor.config.DriftProperties;
import com.example.driftmonitor.model.DriftWindows;
import com.example.driftmonitor.model.EvaluationRecord;
import com.example.driftmonitor.model.InteractionRecord;
import com.example.driftmonitor.model.TaskRecord;
import com.example.driftmonitor.model.TimeWindow;
import com.example.driftmonitor.store.InMemoryLogAccessor;
import com.example.driftmonitor.store.LogStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class AccuracyDriftMonitorTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");
    private static final DriftWindows WINDOWS = DriftWindows.endingAt(NOW, 30, 7);

    private InMemoryLogAccessor logs;
    private AccuracyDriftMonitor monitor;

    @BeforeEach
    void setUp() {
        logs = new InMemoryLogAccessor();
        monitor = new AccuracyDriftMonitor(logs, new DriftProperties.Accuracy(), 10_000,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testDetect_AccuracyDropAboveThreshold() {
        // Given
        evaluation(WINDOWS.getBaseline(), 0, 0.90);
        evaluation(WINDOWS.getBaseline(), 1, 0.92);
        evaluation(WINDOWS.getCurrent(), 0, 0.80);

        // When
        AccuracyDriftReport report = monitor.detect(WINDOWS);

        // Then
        assertTrue(report.isDriftDetected());
        assertTrue(report.getChanges().isAccuracyDriftDetected());
        assertEquals(0.11, report.getChanges().getAccuracyDrop(), 1e-9);
        assertNull(report.getChanges().getFeedbackDropPct());
        assertNull(report.getChanges().getTaskSuccessDrop());
        assertEquals(1.0, report.getDriftScore(), 1e-12);
        assertTrue(report.signals().get(AccuracyDriftReport.SIGNAL));
    }

    @Test
    void testDetect_FeedbackDropAboveThreshold() {
        // Given
        feedback(WINDOWS.getBaseline(), 0, 5.0);
        feedback(WINDOWS.getBaseline(), 1, 4.0);
        feedback(WINDOWS.getCurrent(), 0, 2.0);
        feedback(WINDOWS.getCurrent(), 1, 3.0);

        // When
        AccuracyDriftReport report = monitor.detect(WINDOWS);

        // Then
        assertTrue(report.getChanges().isFeedbackDriftDetected());
        assertEquals((4.5 - 2.5) / 4.5, report.getChanges().getFeedbackDropPct(), 1e-12);
        FeedbackMetrics current = report.getCurrentPeriod().getMetrics().getFeedbackMetrics();
        assertEquals(1, current.getNegativeCount());
        assertEquals(0, current.getPositiveCount());
        assertEquals(1.0, report.getBaselinePeriod().getMetrics().getFeedbackMetrics().getPositiveRate(), 1e-12);
    }

    @Test
    void testDetect_MissingTaskStreamIsOmitted() {
        // Given
        evaluation(WINDOWS.getBaseline(), 0, 0.90);
        evaluation(WINDOWS.getCurrent(), 0, 0.89);

        // When
        AccuracyDriftReport report = monitor.detect(WINDOWS);

        // Then
        assertFalse(report.isDriftDetected());
        assertFalse(report.isInsufficientData());
        assertNull(report.getError());
        assertFalse(report.getCurrentPeriod().getMetrics().getTaskMetrics().isAvailable());
        assertNull(report.getChanges().getTaskSuccessDrop());
        assertEquals(0.2, report.getDriftScore(), 1e-9);
    }

    @Test
    void testDetect_TaskSuccessDrop() {
        // Given
        for (int i = 0; i < 10; i++) {
            task(WINDOWS.getBaseline(), i, i < 9);
            task(WINDOWS.getCurrent(), i, i < 7);
        }

        // When
        AccuracyDriftReport report = monitor.detect(WINDOWS);

        // Then
        assertTrue(report.getChanges().isTaskDriftDetected());
        assertEquals(0.2, report.getChanges().getTaskSuccessDrop(), 1e-9);
        assertTrue(report.isDriftDetected());
    }

    @Test
    void testDetect_NothingComputableScoresZero() {
        // Given
        logs.create(LogStream.TASKS);
        evaluation(WINDOWS.getBaseline(), 0, 0.90);

        // When
        AccuracyDriftReport report = monitor.detect(WINDOWS);

        // Then
        assertFalse(report.isDriftDetected());
        assertTrue(report.isInsufficientData());
        assertEquals(0.0, report.getDriftScore(), 1e-12);
        assertNotNull(report.getError());
    }

    @Test
    void testDetect_AccuracyImprovementIsNotDrift() {
        // Given
        evaluation(WINDOWS.getBaseline(), 0, 0.70);
        evaluation(WINDOWS.getCurrent(), 0, 0.95);

        // When
        AccuracyDriftReport report = monitor.detect(WINDOWS);

        // Then
        assertFalse(report.isDriftDetected());
        assertEquals(0.0, report.getDriftScore(), 1e-12);
    }

    private void evaluation(TimeWindow window, int i, double accuracy) {
        logs.add(LogStream.EVALUATIONS, EvaluationRecord.builder()
                .id("eval-" + window.getStart() + "-" + i)
                .timestamp(window.getStart().plus(Duration.ofHours(i + 1)))
                .evaluationSetName("golden")
                .accuracy(accuracy)
                .precision(accuracy)
                .recall(accuracy)
                .f1Score(accuracy)
                .build());
    }

    private void feedback(TimeWindow window, int i, double score) {
        logs.add(LogStream.INTERACTIONS, InteractionRecord.builder()
                .id("fb-" + window.getStart() + "-" + i)
                .timestamp(window.getStart().plus(Duration.ofHours(i + 1)))
                .modelResponse("answer")
                .userFeedbackScore(score)
                .build());
    }

    private void task(TimeWindow window, int i, boolean success) {
        logs.add(LogStream.TASKS, TaskRecord.builder()
                .id("task-" + window.getStart() + "-" + i)
                .timestamp(window.getStart().plus(Duration.ofHours(i + 1)))
                .taskType("qa")
                .successFlag(success)
                .build());
    }
}
