package com.example.driftmonitor.config;

import com.example.driftmonitor.error.ConfigurationException;
import com.example.driftmonitor.model.EmbeddingType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Recognised options of the drift pipeline, bound from {@code drift.*}.
 * Each monitor receives only its own nested group.
 */
@Data
@ConfigurationProperties(prefix = "drift")
public class DriftProperties {

    private Window window = new Window();
    private Embedding embedding = new Embedding();
    private Behavior behavior = new Behavior();
    private Accuracy accuracy = new Accuracy();
    private Query query = new Query();
    private Pipeline pipeline = new Pipeline();
    private Report report = new Report();
    private Metrics metrics = new Metrics();
    private Actions actions = new Actions();

    @Data
    public static class Window {
        private int baselineDays = 30;
        private int currentDays = 7;
    }

    @Data
    public static class Embedding {
        private EmbeddingType embeddingType = EmbeddingType.QUERY;
        private double distanceThreshold = 0.15;
        private double varianceThreshold = 0.3;
        private double silhouetteThreshold = 0.2;
        private int numClusters = 5;
        private int numComponents = 50;
        private int numBins = 10;
        /** {@code index} compares same-indexed centroids, {@code nearest} matches centroids first. */
        private CentroidMatching centroidMatching = CentroidMatching.INDEX;
        private int kmeansRuns = 10;
        private int maxIterations = 300;
        private long seed = 42L;
        private int silhouetteSampleSize = 2000;
    }

    public enum CentroidMatching { INDEX, NEAREST }

    @Data
    public static class Behavior {
        private double refusalRateThreshold = 0.10;
        private double toxicityRateThreshold = 0.05;
        private double errorRateThreshold = 0.10;
        private double lengthChangeThreshold = 0.5;
    }

    @Data
    public static class Accuracy {
        private double accuracyThreshold = 0.05;
        private double feedbackThreshold = 0.30;
    }

    @Data
    public static class Query {
        /** Upper bound on rows read per stream and window. */
        private int maxRows = 10_000;
    }

    @Data
    public static class Pipeline {
        private boolean parallelMonitors = true;
        private long monitorTimeoutMs = 120_000L;
        private int threads = 3;
        private boolean scheduleEnabled = false;
        private String cron = "0 0 2 * * *";
    }

    @Data
    public static class Report {
        private String directory = "reports";
    }

    @Data
    public static class Metrics {
        private int port = 8000;
    }

    @Data
    public static class Actions {
        private String reindexUrl;
        private String fineTuneUrl;
        private String safetyFilterUrl;
        private long timeoutMs = 30_000L;
        private long ledgerTtlHours = 72L;
    }

    /**
     * @throws ConfigurationException listing every violated rule
     */
    public void validate() {
        List<String> violations = new ArrayList<>();
        if (window.baselineDays <= 0) violations.add("window.baseline-days must be positive");
        if (window.currentDays <= 0) violations.add("window.current-days must be positive");

        if (embedding.distanceThreshold <= 0) violations.add("embedding.distance-threshold must be positive");
        if (embedding.varianceThreshold <= 0) violations.add("embedding.variance-threshold must be positive");
        if (embedding.silhouetteThreshold <= 0) violations.add("embedding.silhouette-threshold must be positive");
        if (embedding.numClusters < 2) violations.add("embedding.num-clusters must be at least 2");
        if (embedding.numComponents < 1) violations.add("embedding.num-components must be at least 1");
        if (embedding.numBins < 2) violations.add("embedding.num-bins must be at least 2");
        if (embedding.kmeansRuns < 1) violations.add("embedding.kmeans-runs must be at least 1");
        if (embedding.maxIterations < 1) violations.add("embedding.max-iterations must be at least 1");
        if (embedding.embeddingType == null) violations.add("embedding.embedding-type is required");

        if (behavior.refusalRateThreshold <= 0) violations.add("behavior.refusal-rate-threshold must be positive");
        if (behavior.toxicityRateThreshold <= 0) violations.add("behavior.toxicity-rate-threshold must be positive");
        if (behavior.errorRateThreshold <= 0) violations.add("behavior.error-rate-threshold must be positive");
        if (behavior.lengthChangeThreshold <= 0) violations.add("behavior.length-change-threshold must be positive");

        if (accuracy.accuracyThreshold <= 0) violations.add("accuracy.accuracy-threshold must be positive");
        if (accuracy.feedbackThreshold <= 0) violations.add("accuracy.feedback-threshold must be positive");

        if (query.maxRows <= 0) violations.add("query.max-rows must be positive");
        if (pipeline.monitorTimeoutMs <= 0) violations.add("pipeline.monitor-timeout-ms must be positive");
        if (pipeline.threads <= 0) violations.add("pipeline.threads must be positive");
        if (metrics.port <= 0 || metrics.port > 65535) violations.add("metrics.port must be a valid TCP port");

        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
    }
}
