package com.example.driftmonitor.monitor.embedding;

import com.example.driftmonitor.config.DriftProperties;
import com.example.driftmonitor.error.DataSourceException;
import com.example.driftmonitor.model.DriftWindows;
import com.example.driftmonitor.model.EmbeddingRecord;
import com.example.driftmonitor.model.EmbeddingType;
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
import java.util.List;

/**
 * Detects distribution shift in embedding vectors with four independent methods:
 * centroid distance, variance change, cluster structure and PSI on the first
 * principal component. Any one of them flags drift.
 */
public class EmbeddingDriftDetector implements DriftMonitor<EmbeddingDriftReport> {

    public static final String NAME = "embedding_drift";

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingDriftDetector.class);

    private final LogAccessor logs;
    private final DriftProperties.Embedding config;
    private final int maxRows;
    private final Clock clock;

    public EmbeddingDriftDetector(LogAccessor logs, DriftProperties.Embedding config, int maxRows, Clock clock) {
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
    public EmbeddingDriftReport detect(DriftWindows windows) {
        return detect(windows, config.getEmbeddingType());
    }

    public EmbeddingDriftReport detect(DriftWindows windows, EmbeddingType type) {
        logger.info("Starting drift detection for {} embeddings", type.value());

        double[][] baseline = load(windows.getBaseline(), type);
        double[][] current = load(windows.getCurrent(), type);

        if (baseline.length == 0 || current.length == 0) {
            logger.warn("Insufficient embeddings for drift detection: baseline={}, current={}",
                    baseline.length, current.length);
            return EmbeddingDriftReport.builder()
                    .timestamp(Instant.now(clock))
                    .embeddingType(type)
                    .baselinePeriod(PeriodSummary.of(windows.getBaseline(), baseline.length, null))
                    .currentPeriod(PeriodSummary.of(windows.getCurrent(), current.length, null))
                    .insufficientData(true)
                    .error("Insufficient data for drift detection")
                    .build();
        }
        if (baseline[0].length != current[0].length) {
            throw new DataSourceException("Embedding dimensionality differs between windows: "
                    + baseline[0].length + " vs " + current[0].length);
        }

        // one eigendecomposition of the baseline serves both the cluster projection and PSI
        PrincipalComponents pca = PrincipalComponents.fit(baseline, Math.max(1, config.getNumComponents()));
        EmbeddingDriftReport report = summarize(type, windows, baseline.length, current.length,
                computeCentroidDistance(baseline, current),
                computeVarianceChange(baseline, current),
                computeClusterDrift(baseline, current, pca),
                computePopulationStabilityIndex(baseline, current, pca));

        logger.info("Embedding drift detection complete: {}", report.isDriftDetected() ? "DRIFT DETECTED" : "NO DRIFT");
        logger.info("Embedding drift score: {}", String.format("%.3f", report.getDriftScore()));
        return report;
    }

    /**
     * Combines the four sub-results: drift if any flags it, score is the mean of
     * each sub-signal over its own threshold, clipped to [0, 1]. An improving
     * silhouette is negative and lowers the mean.
     */
    EmbeddingDriftReport summarize(EmbeddingType type, DriftWindows windows, int baselineCount, int currentCount,
                                   CentroidDistanceResult centroid, VarianceChangeResult variance,
                                   ClusterDriftResult cluster, PsiResult psi) {
        boolean driftDetected = centroid.isDriftDetected()
                || variance.isDriftDetected()
                || cluster.isDriftDetected()
                || psi.isDriftDetected();

        double silhouetteChange = cluster.getSilhouetteChange() == null ? 0.0 : cluster.getSilhouetteChange();
        double[] normalized = {
                DriftScores.ratio(centroid.getEuclideanDistance(), config.getDistanceThreshold()),
                DriftScores.ratio(variance.getVarianceChange(), config.getVarianceThreshold()),
                DriftScores.ratio(silhouetteChange, config.getSilhouetteThreshold()),
                DriftScores.ratio(psi.getPsi(), PopulationStabilityIndex.HIGH)
        };
        double sum = 0.0;
        for (double n : normalized) {
            sum += n;
        }

        return EmbeddingDriftReport.builder()
                .timestamp(Instant.now(clock))
                .embeddingType(type)
                .baselinePeriod(PeriodSummary.of(windows.getBaseline(), baselineCount, null))
                .currentPeriod(PeriodSummary.of(windows.getCurrent(), currentCount, null))
                .driftDetected(driftDetected)
                .driftScore(DriftScores.clip(sum / normalized.length))
                .centroidDistance(centroid)
                .varianceChange(variance)
                .clusterAnalysis(cluster)
                .populationStabilityIndex(psi)
                .build();
    }

    CentroidDistanceResult computeCentroidDistance(double[][] baseline, double[][] current) {
        double[] baselineCentroid = VectorStats.centroid(baseline);
        double[] currentCentroid = VectorStats.centroid(current);

        double euclidean = VectorStats.euclidean(baselineCentroid, currentCentroid);
        double cosine = VectorStats.cosineDistance(baselineCentroid, currentCentroid);
        double threshold = config.getDistanceThreshold();

        return CentroidDistanceResult.builder()
                .euclideanDistance(euclidean)
                .cosineDistance(cosine)
                .threshold(threshold)
                .driftDetected(euclidean > threshold || cosine > threshold)
                .build();
    }

    VarianceChangeResult computeVarianceChange(double[][] baseline, double[][] current) {
        double baselineVariance = VectorStats.populationVariance(baseline);
        double currentVariance = VectorStats.populationVariance(current);
        double change = Math.abs(currentVariance - baselineVariance) / (baselineVariance + VectorStats.EPSILON);

        return VarianceChangeResult.builder()
                .baselineVariance(baselineVariance)
                .currentVariance(currentVariance)
                .varianceChange(change)
                .threshold(config.getVarianceThreshold())
                .driftDetected(change > config.getVarianceThreshold())
                .build();
    }

    /**
     * @param pca principal axes fitted on {@code baseline}
     */
    ClusterDriftResult computeClusterDrift(double[][] baseline, double[][] current, PrincipalComponents pca) {
        int k = config.getNumClusters();
        if (baseline.length < k || current.length < k) {
            logger.warn("Not enough samples for clustering: need {}, baseline={}, current={}",
                    k, baseline.length, current.length);
            return ClusterDriftResult.skipped(ClusterDriftResult.INSUFFICIENT_SAMPLES, k);
        }

        double[][] baselineReduced = pca.transform(baseline);
        double[][] currentReduced = pca.transform(current);

        ClusterAnalysis.Clustering baselineClusters = ClusterAnalysis.kMeans(baselineReduced, k,
                config.getKmeansRuns(), config.getMaxIterations(), config.getSeed());
        ClusterAnalysis.Clustering currentClusters = ClusterAnalysis.kMeans(currentReduced, k,
                config.getKmeansRuns(), config.getMaxIterations(), config.getSeed());

        double baselineSilhouette = ClusterAnalysis.silhouette(baselineClusters, config.getSilhouetteSampleSize());
        double currentSilhouette = ClusterAnalysis.silhouette(currentClusters, config.getSilhouetteSampleSize());
        double silhouetteChange = baselineSilhouette - currentSilhouette;

        double indexShift = ClusterAnalysis.indexAlignedShift(baselineClusters.centroids(), currentClusters.centroids());
        double matchedShift = ClusterAnalysis.matchedShift(baselineClusters.centroids(), currentClusters.centroids());
        boolean nearest = config.getCentroidMatching() == DriftProperties.CentroidMatching.NEAREST;
        double shift = nearest ? matchedShift : indexShift;

        String alignmentWarning = null;
        boolean indexVerdict = indexShift > config.getDistanceThreshold();
        boolean matchedVerdict = matchedShift > config.getDistanceThreshold();
        if (indexVerdict != matchedVerdict) {
            alignmentWarning = "Index-aligned and nearest-matched centroid shifts disagree ("
                    + String.format("%.4f vs %.4f", indexShift, matchedShift)
                    + "); k-means cluster order is not stable across fits";
            logger.warn(alignmentWarning);
        }

        boolean driftDetected = silhouetteChange > config.getSilhouetteThreshold()
                || shift > config.getDistanceThreshold();

        return ClusterDriftResult.builder()
                .baselineSilhouette(baselineSilhouette)
                .currentSilhouette(currentSilhouette)
                .silhouetteChange(silhouetteChange)
                .avgCentroidShift(shift)
                .matchedCentroidShift(matchedShift)
                .centroidMatching(config.getCentroidMatching().name().toLowerCase())
                .alignmentWarning(alignmentWarning)
                .numClusters(k)
                .numComponents(pca.components())
                .driftDetected(driftDetected)
                .driftReason(driftDetected ? "cluster_structure_changed" : null)
                .build();
    }

    PsiResult computePopulationStabilityIndex(double[][] baseline, double[][] current) {
        return computePopulationStabilityIndex(baseline, current, PrincipalComponents.fit(baseline, 1));
    }

    /**
     * PSI of both windows projected on the first axis of {@code pca}, which must be fitted on {@code baseline}.
     */
    PsiResult computePopulationStabilityIndex(double[][] baseline, double[][] current, PrincipalComponents pca) {
        double psi = PopulationStabilityIndex.compute(
                pca.project(baseline), pca.project(current), config.getNumBins());
        return PsiResult.of(psi, config.getNumBins());
    }

    private double[][] load(TimeWindow window, EmbeddingType type) {
        LogQuery query = LogQuery.builder()
                .stream(LogStream.EMBEDDINGS)
                .window(window)
                .category(type.value())
                .limit(maxRows)
                .build();
        List<EmbeddingRecord> rows = logs.getRecords(query, EmbeddingRecord.class);
        logger.info("Retrieved {} embeddings for {}", rows.size(), window);

        double[][] vectors = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            vectors[i] = rows.get(i).toArray();
            if (vectors[i].length == 0 || vectors[i].length != vectors[0].length) {
                throw new DataSourceException("Embedding " + rows.get(i).getId()
                        + " has dimensionality " + vectors[i].length + ", expected " + vectors[0].length);
            }
        }
        return vectors;
    }
}
