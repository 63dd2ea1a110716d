package com.example.driftmonitor.monitor.embedding;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClusterAnalysisTest {

    private static final double[][] TWO_BLOBS = {
            {0.0, 0.0}, {0.1, 0.0}, {0.0, 0.1}, {0.1, 0.1},
            {5.0, 5.0}, {5.1, 5.0}, {5.0, 5.1}, {5.1, 5.1}
    };

    @Test
    void testKMeans_SeparatesBlobs() {
        // When
        ClusterAnalysis.Clustering clustering = ClusterAnalysis.kMeans(TWO_BLOBS, 2, 5, 100, 42L);

        // Then
        int[] labels = clustering.labels();
        assertEquals(labels[0], labels[1]);
        assertEquals(labels[0], labels[3]);
        assertEquals(labels[4], labels[7]);
        assertNotEquals(labels[0], labels[4]);
        assertTrue(ClusterAnalysis.silhouette(clustering, 0) > 0.9);
    }

    @Test
    void testKMeans_SameSeedSameResult() {
        ClusterAnalysis.Clustering first = ClusterAnalysis.kMeans(TWO_BLOBS, 2, 3, 100, 7L);
        ClusterAnalysis.Clustering second = ClusterAnalysis.kMeans(TWO_BLOBS, 2, 3, 100, 7L);

        assertArrayEquals(first.labels(), second.labels());
        assertEquals(0.0, ClusterAnalysis.indexAlignedShift(first.centroids(), second.centroids()), 1e-12);
    }

    @Test
    void testMatchedShift_IgnoresLabelOrder() {
        // Given
        double[][] baseline = {{0.0, 0.0}, {10.0, 0.0}, {0.0, 10.0}};
        double[][] permuted = {{0.0, 10.0}, {0.0, 0.0}, {10.0, 0.0}};

        // When
        double indexShift = ClusterAnalysis.indexAlignedShift(baseline, permuted);
        double matchedShift = ClusterAnalysis.matchedShift(baseline, permuted);

        // Then
        assertTrue(indexShift > 5.0);
        assertEquals(0.0, matchedShift, 1e-12);
    }

    @Test
    void testMatchedShift_GreedyBeyondExhaustiveLimit() {
        int k = ClusterAnalysis.MAX_EXHAUSTIVE_MATCH + 2;
        double[][] baseline = new double[k][];
        double[][] reversed = new double[k][];
        for (int i = 0; i < k; i++) {
            baseline[i] = new double[]{i * 3.0, 0.0};
            reversed[k - 1 - i] = new double[]{i * 3.0, 0.5};
        }

        assertEquals(0.5, ClusterAnalysis.matchedShift(baseline, reversed), 1e-12);
    }

    @Test
    void testSilhouette_SinglePopulatedClusterIsZero() {
        double[][] points = {{1.0, 1.0}, {1.0, 1.0}, {1.0, 1.0}};
        ClusterAnalysis.Clustering clustering =
                new ClusterAnalysis.Clustering(points, new double[][]{{1.0, 1.0}, {9.0, 9.0}}, new int[]{0, 0, 0});

        assertEquals(0.0, ClusterAnalysis.silhouette(clustering, 0));
    }
}
