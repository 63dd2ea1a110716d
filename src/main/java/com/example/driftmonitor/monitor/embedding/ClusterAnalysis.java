package com.example.driftmonitor.monitor.embedding;

import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.DoublePoint;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.clustering.MultiKMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.JDKRandomGenerator;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * k-means++ clustering (best of several seeded runs) and silhouette scoring.
 */
public final class ClusterAnalysis {

    /** Exhaustive centroid matching is used up to this many clusters, greedy beyond. */
    static final int MAX_EXHAUSTIVE_MATCH = 8;

    private ClusterAnalysis() {
    }

    public static final class Clustering {
        private final double[][] points;
        private final double[][] centroids;
        private final int[] labels;

        Clustering(double[][] points, double[][] centroids, int[] labels) {
            this.points = points;
            this.centroids = centroids;
            this.labels = labels;
        }

        public double[][] centroids() { return centroids; }
        public int[] labels() { return labels; }
        public double[][] points() { return points; }
    }

    public static Clustering kMeans(double[][] points, int k, int runs, int maxIterations, long seed) {
        JDKRandomGenerator random = new JDKRandomGenerator();
        random.setSeed(seed);
        KMeansPlusPlusClusterer<DoublePoint> clusterer =
                new KMeansPlusPlusClusterer<>(k, maxIterations, new EuclideanDistance(), random);
        MultiKMeansPlusPlusClusterer<DoublePoint> multi = new MultiKMeansPlusPlusClusterer<>(clusterer, runs);

        List<DoublePoint> wrapped = new ArrayList<>(points.length);
        Map<DoublePoint, Integer> index = new IdentityHashMap<>();
        for (int i = 0; i < points.length; i++) {
            DoublePoint p = new DoublePoint(points[i]);
            wrapped.add(p);
            index.put(p, i);
        }

        List<CentroidCluster<DoublePoint>> clusters = multi.cluster(wrapped);
        double[][] centroids = new double[clusters.size()][];
        int[] labels = new int[points.length];
        for (int c = 0; c < clusters.size(); c++) {
            CentroidCluster<DoublePoint> cluster = clusters.get(c);
            centroids[c] = cluster.getCenter().getPoint();
            for (DoublePoint p : cluster.getPoints()) {
                labels[index.get(p)] = c;
            }
        }
        return new Clustering(points, centroids, labels);
    }

    /**
     * Mean silhouette coefficient. Points in singleton clusters score 0; fewer than
     * two populated clusters yields 0. At most {@code sampleSize} evenly strided points
     * are scored.
     */
    public static double silhouette(Clustering clustering, int sampleSize) {
        double[][] points = clustering.points();
        int[] labels = clustering.labels();
        int k = clustering.centroids().length;

        int[] sizes = new int[k];
        for (int label : labels) {
            sizes[label]++;
        }
        int populated = 0;
        for (int size : sizes) {
            if (size > 0) populated++;
        }
        if (populated < 2 || populated >= points.length) {
            return 0.0;
        }

        int stride = sampleSize > 0 && points.length > sampleSize
                ? (int) Math.ceil((double) points.length / sampleSize)
                : 1;

        double total = 0.0;
        int scored = 0;
        for (int i = 0; i < points.length; i += stride) {
            int own = labels[i];
            scored++;
            if (sizes[own] <= 1) {
                continue;
            }
            double[] distanceSums = new double[k];
            for (int j = 0; j < points.length; j++) {
                if (j != i) {
                    distanceSums[labels[j]] += VectorStats.euclidean(points[i], points[j]);
                }
            }
            double a = distanceSums[own] / (sizes[own] - 1);
            double b = Double.POSITIVE_INFINITY;
            for (int c = 0; c < k; c++) {
                if (c != own && sizes[c] > 0) {
                    b = Math.min(b, distanceSums[c] / sizes[c]);
                }
            }
            double denominator = Math.max(a, b);
            total += denominator == 0.0 ? 0.0 : (b - a) / denominator;
        }
        return scored == 0 ? 0.0 : total / scored;
    }

    /**
     * Average distance between centroid {@code i} of one fit and centroid {@code i} of the other.
     * k-means label order is not stable across independent fits.
     */
    public static double indexAlignedShift(double[][] baseline, double[][] current) {
        int k = Math.min(baseline.length, current.length);
        double sum = 0.0;
        for (int i = 0; i < k; i++) {
            sum += VectorStats.euclidean(baseline[i], current[i]);
        }
        return k == 0 ? 0.0 : sum / k;
    }

    /**
     * Average distance between centroids after pairing each baseline centroid with a
     * distinct current centroid so that the total distance is minimal.
     */
    public static double matchedShift(double[][] baseline, double[][] current) {
        int k = Math.min(baseline.length, current.length);
        if (k == 0) {
            return 0.0;
        }
        double[][] cost = new double[k][k];
        for (int i = 0; i < k; i++) {
            for (int j = 0; j < k; j++) {
                cost[i][j] = VectorStats.euclidean(baseline[i], current[j]);
            }
        }
        double best = k <= MAX_EXHAUSTIVE_MATCH
                ? bestAssignment(cost, 0, new boolean[k], 0.0, Double.POSITIVE_INFINITY)
                : greedyAssignment(cost);
        return best / k;
    }

    private static double bestAssignment(double[][] cost, int row, boolean[] used, double partial, double best) {
        if (partial >= best) {
            return best;
        }
        if (row == cost.length) {
            return partial;
        }
        for (int j = 0; j < cost.length; j++) {
            if (!used[j]) {
                used[j] = true;
                best = bestAssignment(cost, row + 1, used, partial + cost[row][j], best);
                used[j] = false;
            }
        }
        return best;
    }

    private static double greedyAssignment(double[][] cost) {
        int k = cost.length;
        boolean[] rowUsed = new boolean[k];
        boolean[] colUsed = new boolean[k];
        double total = 0.0;
        for (int step = 0; step < k; step++) {
            int bestRow = -1;
            int bestCol = -1;
            for (int i = 0; i < k; i++) {
                if (rowUsed[i]) continue;
                for (int j = 0; j < k; j++) {
                    if (!colUsed[j] && (bestRow < 0 || cost[i][j] < cost[bestRow][bestCol])) {
                        bestRow = i;
                        bestCol = j;
                    }
                }
            }
            rowUsed[bestRow] = true;
            colUsed[bestCol] = true;
            total += cost[bestRow][bestCol];
        }
        return total;
    }
}
