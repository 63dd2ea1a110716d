package com.example.driftmonitor.monitor.accuracy;

import com.example.driftmonitor.config.DriftProperties;
import com.example.driftmonitor.model.DriftWindows;
import com.example.driftmonitor.model.EvaluationRecord;
import com.example.driftmonitor.model.InteractionRecord;
import com.example.driftmonitor.model.TaskRecord;
import com.example.driftmonitor.model.TimeWindow;
import com.example.driftmonitor.monitor.DriftMonitor;
import com.example.driftmonitor.monitor.DriftScores;
import com.example.driftmonitor.monitor.PeriodSummary;
import com.example.driftmonitor.store.LogAccessor;
import com.example.driftmonitor.store.LogQuery;
import com.example.driftmonitor.store.LogStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares evaluation accuracy, user feedback and task success between the baseline
 * and current windows. Each comparison only runs when both windows have data for it.
 */
public class AccuracyDriftMonitor implements DriftMonitor<AccuracyDriftReport> {

    public static final String NAME = "accuracy_drift";

    private static final Logger logger = LoggerFactory.getLogger(AccuracyDriftMonitor.class);

    private final LogAccessor logs;
    private final DriftProperties.Accuracy config;
    private final int maxRows;
    private final Clock clock;

    public AccuracyDriftMonitor(LogAccessor logs, DriftProperties.Accuracy config, int maxRows, Clock clock) {
        this.logs = logs;
        this.config = config;
        this.maxRows = maxRows;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AccuracyDriftReport detect(DriftWindows windows) {
        logger.info("Starting accuracy drift detection");

        AccuracyPeriodMetrics baseline = periodMetrics(windows.getBaseline());
        AccuracyPeriodMetrics current = periodMetrics(windows.getCurrent());

        List<Double> components = new ArrayList<>();

        Double accuracyDrop = null;
        boolean accuracyDrift = false;
        Double baselineAccuracy = baseline.getEvaluationMetrics().getAvgAccuracy();
        Double currentAccuracy = current.getEvaluationMetrics().getAvgAccuracy();
        if (baselineAccuracy != null && currentAccuracy != null) {
            accuracyDrop = baselineAccuracy - currentAccuracy;
            accuracyDrift = accuracyDrop > config.getAccuracyThreshold();
            components.add(DriftScores.ratio(accuracyDrop, config.getAccuracyThreshold()));
        }

        Double feedbackDrop = null;
        boolean feedbackDrift = false;
        Double baselineRating = baseline.getFeedbackMetrics().getAvgRating();
        Double currentRating = current.getFeedbackMetrics().getAvgRating();
        if (baselineRating != null && currentRating != null && baselineRating > 0) {
            feedbackDrop = (baselineRating - currentRating) / baselineRating;
            feedbackDrift = feedbackDrop > config.getFeedbackThreshold();
            components.add(DriftScores.ratio(feedbackDrop, config.getFeedbackThreshold()));
        }

        Double taskDrop = null;
        boolean taskDrift = false;
        Double baselineSuccess = baseline.getTaskMetrics().getSuccessRate();
        Double currentSuccess = current.getTaskMetrics().getSuccessRate();
        if (baselineSuccess != null && currentSuccess != null) {
            taskDrop = baselineSuccess - currentSuccess;
            taskDrift = taskDrop > config.getAccuracyThreshold();
            components.add(DriftScores.ratio(taskDrop, config.getAccuracyThreshold()));
        }

        boolean driftDetected = accuracyDrift || feedbackDrift || taskDrift;
        double score = components.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);

        logger.info("Accuracy drift detection complete: {}", driftDetected ? "DRIFT DETECTED" : "NO DRIFT");
        if (accuracyDrift) {
            logger.warn("Accuracy dropped by {}", String.format("%.2f%%", accuracyDrop * 100));
        }
        if (feedbackDrift) {
            logger.warn("User feedback dropped by {}", String.format("%.2f%%", feedbackDrop * 100));
        }
        if (taskDrift) {
            logger.warn("Task success rate dropped by {}", String.format("%.2f%%", taskDrop * 100));
        }

        return AccuracyDriftReport.builder()
                .timestamp(Instant.now(clock))
                .baselinePeriod(PeriodSummary.of(windows.getBaseline(),
                        baseline.getEvaluationMetrics().getEvaluationCount(), baseline))
                .currentPeriod(PeriodSummary.of(windows.getCurrent(),
                        current.getEvaluationMetrics().getEvaluationCount(), current))
                .driftDetected(driftDetected)
                .driftScore(DriftScores.clip(score))
                .insufficientData(components.isEmpty())
                .error(components.isEmpty() ? "Insufficient data for accuracy drift detection" : null)
                .changes(AccuracyChanges.builder()
                        .accuracyDrop(accuracyDrop)
                        .accuracyDriftDetected(accuracyDrift)
                        .feedbackDropPct(feedbackDrop)
                        .feedbackDriftDetected(feedbackDrift)
                        .taskSuccessDrop(taskDrop)
                        .taskDriftDetected(taskDrift)
                        .build())
                .thresholds(Map.of(
                        "accuracy_threshold", config.getAccuracyThreshold(),
                        "feedback_threshold", config.getFeedbackThreshold()))
                .build();
    }

    private AccuracyPeriodMetrics periodMetrics(TimeWindow window) {
        List<EvaluationRecord> evaluations =
                logs.getRecords(LogQuery.of(LogStream.EVALUATIONS, window, maxRows), EvaluationRecord.class);
        List<InteractionRecord> interactions =
                logs.getRecords(LogQuery.of(LogStream.INTERACTIONS, window, maxRows), InteractionRecord.class);
        return new AccuracyPeriodMetrics(
                EvaluationMetrics.of(evaluations),
                FeedbackMetrics.of(interactions),
                taskMetrics(window));
    }

    private TaskMetrics taskMetrics(TimeWindow window) {
        if (!logs.streamExists(LogStream.TASKS)) {
            logger.info("{} not found - skipping task metrics", LogStream.TASKS.collection());
            return TaskMetrics.unavailable();
        }
        return TaskMetrics.of(logs.getRecords(LogQuery.of(LogStream.TASKS, window, maxRows), TaskRecord.class));
    }
}
