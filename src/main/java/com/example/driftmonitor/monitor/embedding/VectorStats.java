package com.example.driftmonitor.monitor.embedding;

import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

/**
 * Whole-window statistics over embedding matrices ({@code n_samples x dim}).
 */
public final class VectorStats {

    static final double EPSILON = 1e-10;

    private static final EuclideanDistance EUCLIDEAN = new EuclideanDistance();

    private VectorStats() {
    }

    public static double[] centroid(double[][] vectors) {
        double[] centroid = new double[vectors[0].length];
        for (double[] v : vectors) {
            for (int i = 0; i < centroid.length; i++) {
                centroid[i] += v[i];
            }
        }
        for (int i = 0; i < centroid.length; i++) {
            centroid[i] /= vectors.length;
        }
        return centroid;
    }

    public static double euclidean(double[] a, double[] b) {
        return EUCLIDEAN.compute(a, b);
    }

    /**
     * Cosine distance after L2-normalising both vectors (norm + epsilon).
     * Two zero vectors are at distance 0.
     */
    public static double cosineDistance(double[] a, double[] b) {
        double[] an = normalize(a);
        double[] bn = normalize(b);
        double dot = 0.0;
        for (int i = 0; i < an.length; i++) {
            dot += an[i] * bn[i];
        }
        double denominator = norm(an) * norm(bn);
        if (denominator == 0.0) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - dot / denominator);
    }

    /**
     * Population variance over every coordinate of every vector.
     */
    public static double populationVariance(double[][] vectors) {
        Variance variance = new Variance(false);
        for (double[] v : vectors) {
            variance.incrementAll(v);
        }
        return variance.getResult();
    }

    static double norm(double[] v) {
        double sum = 0.0;
        for (double x : v) {
            sum += x * x;
        }
        return Math.sqrt(sum);
    }

    static double[] normalize(double[] v) {
        double n = norm(v) + EPSILON;
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = v[i] / n;
        }
        return out;
    }
}
