package com.example.driftmonitor.monitor.embedding;

import com.example.driftmonitor.config.DriftProperties;
import com.example.driftmonitor.error.DataSourceException;
import com.example.driftmonitor.model.DriftWindows;
import com.example.driftmonitor.model.EmbeddingRecord;
import com.example.driftmonitor.model.EmbeddingType;
import com.example.driftmonitor.model.TimeWindow;
import com.example.driftmonitor.store.InMemoryLogAccessor;
import com.example.driftmonitor.store.LogStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingDriftDetectorTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");
    private static final DriftWindows WINDOWS = DriftWindows.endingAt(NOW, 30, 7);

    private InMemoryLogAccessor logs;
    private DriftProperties.Embedding config;
    private EmbeddingDriftDetector detector;

    @BeforeEach
    void setUp() {
        logs = new InMemoryLogAccessor();
        config = new DriftProperties.Embedding();
        detector = new EmbeddingDriftDetector(logs, config, 10_000, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testDetect_IdenticalWindowsReportNoDrift() {
        // Given
        double[][] vectors = gaussian(40, 8, 7L, 0.0);
        store(WINDOWS.getBaseline(), vectors, "query");
        store(WINDOWS.getCurrent(), vectors, "query");

        // When
        EmbeddingDriftReport report = detector.detect(WINDOWS);

        // Then
        assertFalse(report.isDriftDetected());
        assertEquals(0.0, report.getDriftScore(), 1e-9);
        assertEquals(0.0, report.getCentroidDistance().getEuclideanDistance(), 1e-12);
        assertEquals(0.0, report.getCentroidDistance().getCosineDistance(), 1e-9);
        assertEquals(0.0, report.getVarianceChange().getVarianceChange(), 1e-12);
        assertEquals(0.0, report.getPopulationStabilityIndex().getPsi(), 1e-12);
        assertFalse(report.getClusterAnalysis().isSkipped());
        assertEquals(0.0, report.getClusterAnalysis().getSilhouetteChange(), 1e-12);
        assertEquals(0.0, report.getClusterAnalysis().getAvgCentroidShift(), 1e-12);
        assertNull(report.getClusterAnalysis().getAlignmentWarning());
        assertEquals(40, report.getBaselinePeriod().getSampleCount());
        assertEquals(40, report.getCurrentPeriod().getSampleCount());
    }

    @Test
    void testDetect_ShiftedCentroidIsDrift() {
        // Given
        store(WINDOWS.getBaseline(), gaussian(40, 8, 7L, 0.0), "query");
        store(WINDOWS.getCurrent(), gaussian(40, 8, 11L, 1.0), "query");

        // When
        EmbeddingDriftReport report = detector.detect(WINDOWS);

        // Then
        assertTrue(report.isDriftDetected());
        assertTrue(report.getCentroidDistance().isDriftDetected());
        assertTrue(report.getCentroidDistance().getEuclideanDistance() > config.getDistanceThreshold());
        assertTrue(report.signals().get(EmbeddingDriftReport.SIGNAL));
    }

    @Test
    void testDetect_ScoreIsClippedForExtremeShift() {
        // Given
        store(WINDOWS.getBaseline(), gaussian(30, 4, 1L, 0.0), "query");
        store(WINDOWS.getCurrent(), gaussian(30, 4, 2L, 1_000.0), "query");

        // When
        EmbeddingDriftReport report = detector.detect(WINDOWS);

        // Then
        assertTrue(report.isDriftDetected());
        assertEquals(1.0, report.getDriftScore(), 1e-12);
    }

    @Test
    void testDetect_OnlyRequestedTypeIsRead() {
        // Given
        double[][] vectors = gaussian(20, 4, 3L, 0.0);
        store(WINDOWS.getBaseline(), vectors, "query");
        store(WINDOWS.getCurrent(), vectors, "query");
        store(WINDOWS.getCurrent(), gaussian(20, 4, 4L, 50.0), "doc");

        // When
        EmbeddingDriftReport queryReport = detector.detect(WINDOWS, EmbeddingType.QUERY);
        EmbeddingDriftReport docReport = detector.detect(WINDOWS, EmbeddingType.DOC);

        // Then
        assertFalse(queryReport.isDriftDetected());
        assertTrue(docReport.isInsufficientData());
        assertEquals(0, docReport.getBaselinePeriod().getSampleCount());
    }

    @Test
    void testDetect_EmptyCurrentWindowIsInsufficientData() {
        // Given
        store(WINDOWS.getBaseline(), gaussian(20, 4, 3L, 0.0), "query");

        // When
        EmbeddingDriftReport report = detector.detect(WINDOWS);

        // Then
        assertTrue(report.isInsufficientData());
        assertFalse(report.isDriftDetected());
        assertNull(report.getDriftScore());
        assertNotNull(report.getError());
        assertFalse(report.signals().get(EmbeddingDriftReport.SIGNAL));
    }

    @Test
    void testDetect_DimensionMismatchIsDataSourceError() {
        // Given
        store(WINDOWS.getBaseline(), gaussian(10, 4, 3L, 0.0), "query");
        store(WINDOWS.getCurrent(), gaussian(10, 6, 3L, 0.0), "query");

        // When / Then
        assertThrows(DataSourceException.class, () -> detector.detect(WINDOWS));
    }

    @Test
    void testDetect_TooFewSamplesSkipsClusterAnalysis() {
        // Given
        double[][] vectors = gaussian(3, 4, 3L, 0.0);
        store(WINDOWS.getBaseline(), vectors, "query");
        store(WINDOWS.getCurrent(), vectors, "query");

        // When
        EmbeddingDriftReport report = detector.detect(WINDOWS);

        // Then
        assertTrue(report.getClusterAnalysis().isSkipped());
        assertEquals(ClusterDriftResult.INSUFFICIENT_SAMPLES, report.getClusterAnalysis().getReason());
        assertFalse(report.getClusterAnalysis().isDriftDetected());
        assertFalse(report.isDriftDetected());
    }

    @Test
    void testSummarize_PsiAloneTriggersDrift() {
        // Given
        CentroidDistanceResult centroid = CentroidDistanceResult.builder()
                .euclideanDistance(0.05).cosineDistance(0.01).threshold(0.15).driftDetected(false).build();
        VarianceChangeResult variance = VarianceChangeResult.builder()
                .baselineVariance(1.0).currentVariance(1.0).varianceChange(0.0).threshold(0.3).driftDetected(false)
                .build();
        ClusterDriftResult cluster = ClusterDriftResult.skipped(ClusterDriftResult.INSUFFICIENT_SAMPLES, 5);
        PsiResult psi = PsiResult.of(0.25, 10);

        // When
        EmbeddingDriftReport report = detector.summarize(EmbeddingType.QUERY, WINDOWS, 100, 100,
                centroid, variance, cluster, psi);

        // Then
        assertTrue(report.isDriftDetected());
        assertEquals("high", report.getPopulationStabilityIndex().getDriftLevel());
        // (0.05/0.15 + 0 + 0 + 0.25/0.2) / 4
        assertEquals((0.05 / 0.15 + 1.25) / 4, report.getDriftScore(), 1e-9);
    }

    @Test
    void testSummarize_ImprovingSilhouetteLowersTheMean() {
        // Given
        CentroidDistanceResult centroid = CentroidDistanceResult.builder()
                .euclideanDistance(0.15).cosineDistance(0.0).threshold(0.15).driftDetected(false).build();
        VarianceChangeResult variance = VarianceChangeResult.builder()
                .varianceChange(0.0).threshold(0.3).driftDetected(false).build();
        ClusterDriftResult cluster = ClusterDriftResult.builder()
                .silhouetteChange(-0.4).avgCentroidShift(0.0).driftDetected(false).build();
        PsiResult psi = PsiResult.of(0.0, 10);

        // When
        EmbeddingDriftReport report = detector.summarize(EmbeddingType.QUERY, WINDOWS, 10, 10,
                centroid, variance, cluster, psi);

        // Then: (1 + 0 - 2 + 0) / 4 clipped
        assertEquals(0.0, report.getDriftScore(), 1e-9);
    }

    @Test
    void testCentroidDistance_CosineIsScaleInvariant() {
        // Given
        double[][] baseline = gaussian(25, 6, 5L, 0.3);
        double[][] current = gaussian(25, 6, 9L, 0.1);

        // When
        double original = detector.computeCentroidDistance(baseline, current).getCosineDistance();
        double scaled = detector.computeCentroidDistance(scale(baseline, 42.0), scale(current, 42.0)).getCosineDistance();

        // Then
        assertEquals(original, scaled, 1e-9);
    }

    @Test
    void testPopulationStabilityIndex_SameSampleIsZero() {
        // Given
        double[][] vectors = gaussian(60, 5, 13L, 0.0);

        // When / Then
        for (int bins = 2; bins <= 20; bins++) {
            config.setNumBins(bins);
            assertEquals(0.0, detector.computePopulationStabilityIndex(vectors, vectors).getPsi(), 1e-12);
        }
    }

    @Test
    void testPopulationStabilityIndex_SharedProjectionMatchesFirstAxisFit() {
        // Given
        double[][] baseline = gaussian(80, 6, 21L, 0.0);
        double[][] current = gaussian(80, 6, 22L, 0.4);
        PrincipalComponents shared = PrincipalComponents.fit(baseline, config.getNumComponents());

        // When
        double own = detector.computePopulationStabilityIndex(baseline, current).getPsi();
        double reused = detector.computePopulationStabilityIndex(baseline, current, shared).getPsi();

        // Then
        assertEquals(own, reused, 1e-9);
    }

    @Test
    void testDetect_PsiUsesClusterProjection() {
        // Given
        double[][] baseline = gaussian(40, 6, 31L, 0.0);
        double[][] current = gaussian(40, 6, 32L, 0.5);
        store(WINDOWS.getBaseline(), baseline, "query");
        store(WINDOWS.getCurrent(), current, "query");

        // When
        EmbeddingDriftReport report = detector.detect(WINDOWS);

        // Then
        assertFalse(report.getClusterAnalysis().isSkipped());
        assertEquals(detector.computePopulationStabilityIndex(baseline, current).getPsi(),
                report.getPopulationStabilityIndex().getPsi(), 1e-9);
    }

    private void store(TimeWindow window, double[][] vectors, String type) {
        for (int i = 0; i < vectors.length; i++) {
            List<Double> v = new ArrayList<>();
            for (double x : vectors[i]) {
                v.add(x);
            }
            logs.add(LogStream.EMBEDDINGS, EmbeddingRecord.builder()
                    .id(type + "-" + window.getStart() + "-" + i)
                    .timestamp(window.getStart().plus(Duration.ofMinutes(i + 1)))
                    .type(type)
                    .vector(v)
                    .build());
        }
    }

    static double[][] gaussian(int n, int dim, long seed, double offset) {
        Random random = new Random(seed);
        double[][] out = new double[n][dim];
        for (int i = 0; i < n; i++) {
            for (int d = 0; d < dim; d++) {
                out[i][d] = random.nextGaussian() * 0.1 + offset;
            }
        }
        return out;
    }

    private static double[][] scale(double[][] vectors, double factor) {
        double[][] out = new double[vectors.length][];
        for (int i = 0; i < vectors.length; i++) {
            out[i] = new double[vectors[i].length];
            for (int d = 0; d < vectors[i].length; d++) {
                out[i][d] = vectors[i][d] * factor;
            }
        }
        return out;
    }
}
