package com.example.driftmonitor.monitor.behavior;

import com.example.driftmonitor.config.DriftProperties;
import com.example.driftmonitor.error.InvalidQueryException;
import com.example.driftmonitor.model.DriftWindows;
import com.example.driftmonitor.model.InteractionRecord;
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
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Tracks refusal, toxicity and error rates and response length of the served model.
 *
 * <p>Refusal, toxicity and error drift compare the <em>current</em> rate against an absolute
 * threshold, not against the baseline: a persistently high rate keeps triggering even without
 * recent change. Only the response length is compared relative to the baseline.
 */
public class BehaviorDriftMonitor implements DriftMonitor<BehaviorDriftReport> {

    public static final String NAME = "behavior_drift";

    private static final Logger logger = LoggerFactory.getLogger(BehaviorDriftMonitor.class);

    private final LogAccessor logs;
    private final DriftProperties.Behavior config;
    private final int maxRows;
    private final Clock clock;

    public BehaviorDriftMonitor(LogAccessor logs, DriftProperties.Behavior config, int maxRows, Clock clock) {
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
    public BehaviorDriftReport detect(DriftWindows windows) {
        logger.info("Starting behavior drift detection");

        BehaviorMetrics baseline = BehaviorMetrics.of(interactions(windows.getBaseline()));
        BehaviorMetrics current = BehaviorMetrics.of(interactions(windows.getCurrent()));

        if (baseline.getTotalInteractions() == 0 || current.getTotalInteractions() == 0) {
            logger.warn("Insufficient interactions for behavior drift detection: baseline={}, current={}",
                    baseline.getTotalInteractions(), current.getTotalInteractions());
            return BehaviorDriftReport.builder()
                    .timestamp(Instant.now(clock))
                    .insufficientData(true)
                    .error("Insufficient data for behavior drift detection")
                    .baselineInteractions(baseline.getTotalInteractions())
                    .currentInteractions(current.getTotalInteractions())
                    .build();
        }

        boolean refusalDrift = current.getRefusalRate() > config.getRefusalRateThreshold();
        boolean toxicityDrift = current.getToxicityRate() > config.getToxicityRateThreshold();
        boolean errorDrift = current.getErrorRate() > config.getErrorRateThreshold();

        double lengthChange = 0.0;
        if (baseline.getAvgResponseLength() > 0) {
            lengthChange = Math.abs(current.getAvgResponseLength() - baseline.getAvgResponseLength())
                    / baseline.getAvgResponseLength();
        }
        boolean lengthAnomaly = lengthChange > config.getLengthChangeThreshold();

        boolean driftDetected = refusalDrift || toxicityDrift || errorDrift || lengthAnomaly;
        double score = Math.max(
                Math.max(DriftScores.ratio(current.getRefusalRate(), config.getRefusalRateThreshold()),
                        DriftScores.ratio(current.getToxicityRate(), config.getToxicityRateThreshold())),
                Math.max(DriftScores.ratio(current.getErrorRate(), config.getErrorRateThreshold()),
                        DriftScores.ratio(lengthChange, config.getLengthChangeThreshold())));

        BehaviorChanges changes = BehaviorChanges.builder()
                .refusalRateChange(current.getRefusalRate() - baseline.getRefusalRate())
                .refusalDriftDetected(refusalDrift)
                .toxicityRateChange(current.getToxicityRate() - baseline.getToxicityRate())
                .toxicityDriftDetected(toxicityDrift)
                .errorRateChange(current.getErrorRate() - baseline.getErrorRate())
                .errorDriftDetected(errorDrift)
                .responseLengthChange(lengthChange)
                .lengthAnomalyDetected(lengthAnomaly)
                .build();

        logger.info("Behavior drift detection complete: {}", driftDetected ? "DRIFT DETECTED" : "NO DRIFT");
        if (refusalDrift) {
            logger.warn("Refusal rate {} exceeds threshold {}",
                    percent(current.getRefusalRate()), percent(config.getRefusalRateThreshold()));
        }
        if (toxicityDrift) {
            logger.warn("Toxicity rate {} exceeds threshold {}",
                    percent(current.getToxicityRate()), percent(config.getToxicityRateThreshold()));
        }
        if (errorDrift) {
            logger.warn("Error rate {} exceeds threshold {}",
                    percent(current.getErrorRate()), percent(config.getErrorRateThreshold()));
        }

        return BehaviorDriftReport.builder()
                .timestamp(Instant.now(clock))
                .baselinePeriod(PeriodSummary.of(windows.getBaseline(), baseline.getTotalInteractions(), baseline))
                .currentPeriod(PeriodSummary.of(windows.getCurrent(), current.getTotalInteractions(), current))
                .driftDetected(driftDetected)
                .driftScore(DriftScores.clip(score))
                .changes(changes)
                .thresholds(Map.of(
                        "refusal_rate", config.getRefusalRateThreshold(),
                        "toxicity_rate", config.getToxicityRateThreshold(),
                        "error_rate", config.getErrorRateThreshold(),
                        "response_length_change", config.getLengthChangeThreshold()))
                .build();
    }

    /**
     * Most recent refusal-flagged interactions of the last {@code days} days, newest first,
     * regardless of whether drift was detected. {@code limit} is clamped to {@code [1, maxRows]}.
     *
     * @throws InvalidQueryException when {@code days} is not positive
     */
    public List<RefusalSample> recentRefusals(int days, int limit) {
        if (days <= 0) {
            throw new InvalidQueryException("days must be positive, got " + days);
        }
        int rows = Math.max(1, Math.min(limit, maxRows));
        Instant now = Instant.now(clock);
        LogQuery query = LogQuery.builder()
                .stream(LogStream.INTERACTIONS)
                .window(new TimeWindow(now.minus(Duration.ofDays(days)), now))
                .category(InteractionRecord.CATEGORY_REFUSAL)
                .limit(rows)
                .newestFirst(true)
                .build();
        return logs.getRecords(query, InteractionRecord.class).stream()
                .map(r -> RefusalSample.builder()
                        .query(r.getUserQuery())
                        .response(r.getModelResponse())
                        .timestamp(r.getTimestamp())
                        .pattern(RefusalDetector.matchedPattern(r.getModelResponse()).orElse(null))
                        .build())
                .collect(Collectors.toList());
    }

    private List<InteractionRecord> interactions(TimeWindow window) {
        return logs.getRecords(LogQuery.of(LogStream.INTERACTIONS, window, maxRows), InteractionRecord.class);
    }

    private static String percent(double rate) {
        return String.format("%.2f%%", rate * 100.0);
    }
}
