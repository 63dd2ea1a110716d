package com.example.driftmonitor.monitor.behavior;

import com.example.driftmonitor.config.DriftProperties;
import com.example.driftmonitor.error.InvalidQueryException;
import com.example.driftmonitor.model.DriftWindows;
import com.example.driftmonitor.model.InteractionRecord;
import com.example.driftmonitor.model.TimeWindow;
import com.example.driftmonitor.store.InMemoryLogAccessor;
import com.example.driftmonitor.store.LogStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BehaviorDriftMonitorTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");
    private static final DriftWindows WINDOWS = DriftWindows.endingAt(NOW, 30, 7);

    private InMemoryLogAccessor logs;
    private DriftProperties.Behavior config;
    private BehaviorDriftMonitor monitor;

    @BeforeEach
    void setUp() {
        logs = new InMemoryLogAccessor();
        config = new DriftProperties.Behavior();
        monitor = new BehaviorDriftMonitor(logs, config, 10_000, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testDetect_RefusalRateAboveThreshold() {
        // Given
        interactions(WINDOWS.getBaseline(), 50, 1, 0, 0);
        interactions(WINDOWS.getCurrent(), 100, 15, 0, 0);

        // When
        BehaviorDriftReport report = monitor.detect(WINDOWS);

        // Then
        assertTrue(report.isDriftDetected());
        assertTrue(report.getChanges().isRefusalDriftDetected());
        assertFalse(report.getChanges().isToxicityDriftDetected());
        assertEquals(0.02, report.getBaselinePeriod().getMetrics().getRefusalRate(), 1e-12);
        assertEquals(0.15, report.getCurrentPeriod().getMetrics().getRefusalRate(), 1e-12);
        assertEquals(0.13, report.getChanges().getRefusalRateChange(), 1e-12);
        assertTrue(report.signals().get(BehaviorDriftReport.REFUSAL_SIGNAL));
        assertEquals(1.0, report.getDriftScore(), 1e-12);
    }

    @Test
    void testDetect_HighRateRetriggersWithoutChange() {
        // Given
        interactions(WINDOWS.getBaseline(), 100, 20, 0, 0);
        interactions(WINDOWS.getCurrent(), 100, 20, 0, 0);

        // When
        BehaviorDriftReport report = monitor.detect(WINDOWS);

        // Then
        assertTrue(report.getChanges().isRefusalDriftDetected());
        assertEquals(0.0, report.getChanges().getRefusalRateChange(), 1e-12);
    }

    @Test
    void testDetect_ToxicityAndErrorSignals() {
        // Given
        interactions(WINDOWS.getBaseline(), 100, 0, 0, 0);
        interactions(WINDOWS.getCurrent(), 100, 0, 6, 11);

        // When
        BehaviorDriftReport report = monitor.detect(WINDOWS);

        // Then
        assertTrue(report.getChanges().isToxicityDriftDetected());
        assertTrue(report.getChanges().isErrorDriftDetected());
        assertFalse(report.getChanges().isRefusalDriftDetected());
        assertTrue(report.signals().get(BehaviorDriftReport.TOXICITY_SIGNAL));
        assertTrue(report.signals().get(BehaviorDriftReport.ERROR_SIGNAL));
    }

    @Test
    void testDetect_NoDriftScoreIsRatioToThreshold() {
        // Given
        interactions(WINDOWS.getBaseline(), 100, 2, 0, 0);
        interactions(WINDOWS.getCurrent(), 100, 5, 0, 0);

        // When
        BehaviorDriftReport report = monitor.detect(WINDOWS);

        // Then
        assertFalse(report.isDriftDetected());
        assertEquals(0.5, report.getDriftScore(), 1e-12);
    }

    @Test
    void testDetect_ResponseLengthAnomaly() {
        // Given
        for (int i = 0; i < 10; i++) {
            logs.add(LogStream.INTERACTIONS, interaction(WINDOWS.getBaseline(), i, "x".repeat(100), false));
            logs.add(LogStream.INTERACTIONS, interaction(WINDOWS.getCurrent(), i, "x".repeat(40), false));
        }

        // When
        BehaviorDriftReport report = monitor.detect(WINDOWS);

        // Then
        assertTrue(report.getChanges().isLengthAnomalyDetected());
        assertEquals(60.0, report.getChanges().getResponseLengthChangePct(), 1e-9);
        assertTrue(report.isDriftDetected());
    }

    @Test
    void testDetect_ZeroCurrentInteractionsIsInsufficient() {
        // Given
        interactions(WINDOWS.getBaseline(), 50, 1, 0, 0);

        // When
        BehaviorDriftReport report = monitor.detect(WINDOWS);

        // Then
        assertTrue(report.getError().startsWith("Insufficient data"));
        assertEquals(0, (int) report.getCurrentInteractions());
        assertEquals(50, (int) report.getBaselineInteractions());
        assertTrue(report.isInsufficientData());
        assertFalse(report.isDriftDetected());
        assertNull(report.getDriftScore());
        assertTrue(report.signals().values().stream().noneMatch(Boolean::booleanValue));
    }

    @Test
    void testRecentRefusals_NewestFirstWithPattern() {
        // Given
        Instant now = NOW;
        logs.add(LogStream.INTERACTIONS, InteractionRecord.builder().id("old")
                .timestamp(now.minus(Duration.ofDays(3))).userQuery("q1")
                .modelResponse("As an AI, I won't do that").refusalFlag(true).build());
        logs.add(LogStream.INTERACTIONS, InteractionRecord.builder().id("new")
                .timestamp(now.minus(Duration.ofHours(2))).userQuery("q2")
                .modelResponse("I'm sorry, but I cannot help with that.").refusalFlag(true).build());
        logs.add(LogStream.INTERACTIONS, InteractionRecord.builder().id("ok")
                .timestamp(now.minus(Duration.ofHours(1))).userQuery("q3")
                .modelResponse("Sure, here it is.").refusalFlag(false).build());
        logs.add(LogStream.INTERACTIONS, InteractionRecord.builder().id("too-old")
                .timestamp(now.minus(Duration.ofDays(10))).userQuery("q4")
                .modelResponse("I cannot").refusalFlag(true).build());

        // When
        List<RefusalSample> samples = monitor.recentRefusals(7, 10);

        // Then
        assertEquals(2, samples.size());
        assertEquals("q2", samples.get(0).getQuery());
        assertEquals("i'm sorry, but i cannot", samples.get(0).getPattern());
        assertEquals("as an ai", samples.get(1).getPattern());
    }

    @Test
    void testRecentRefusals_NonPositiveLimitReadsOneRow() {
        // Given
        recentRefusals(3);

        // When / Then
        assertEquals(1, monitor.recentRefusals(7, 0).size());
        assertEquals(1, monitor.recentRefusals(7, -5).size());
    }

    @Test
    void testRecentRefusals_LimitCappedAtMaxRows() {
        // Given
        recentRefusals(5);
        BehaviorDriftMonitor capped = new BehaviorDriftMonitor(logs, config, 2, Clock.fixed(NOW, ZoneOffset.UTC));

        // When
        List<RefusalSample> samples = capped.recentRefusals(7, 1_000);

        // Then
        assertEquals(2, samples.size());
    }

    @Test
    void testRecentRefusals_NonPositiveDaysRejected() {
        assertThrows(InvalidQueryException.class, () -> monitor.recentRefusals(0, 10));
        assertThrows(InvalidQueryException.class, () -> monitor.recentRefusals(-3, 10));
    }

    @Test
    void testRefusalDetector_MatchesCurlyApostrophes() {
        assertTrue(RefusalDetector.isRefusal("I’m unable to share that"));
        assertFalse(RefusalDetector.isRefusal("Here is the summary you asked for"));
        assertFalse(RefusalDetector.isRefusal(null));
    }

    private void recentRefusals(int count) {
        for (int i = 0; i < count; i++) {
            logs.add(LogStream.INTERACTIONS, InteractionRecord.builder().id("refusal-" + i)
                    .timestamp(NOW.minus(Duration.ofHours(i + 1))).userQuery("q" + i)
                    .modelResponse("I cannot help with that").refusalFlag(true).build());
        }
    }

    private void interactions(TimeWindow window, int total, int refusals, int toxic, int errors) {
        for (int i = 0; i < total; i++) {
            InteractionRecord r = interaction(window, i, "response " + i, i < refusals);
            r.setToxicityFlag(i < toxic);
            r.setErrorFlag(i < errors);
            logs.add(LogStream.INTERACTIONS, r);
        }
    }

    private static InteractionRecord interaction(TimeWindow window, int i, String response, boolean refusal) {
        return InteractionRecord.builder()
                .id(window.getStart() + "-" + i)
                .timestamp(window.getStart().plus(Duration.ofMinutes(i + 1)))
                .userQuery("query " + i)
                .modelResponse(response)
                .refusalFlag(refusal)
                .build();
    }
}
