package com.example.driftmonitor.monitor.embedding;

import org.apache.commons.math3.linear.BlockRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Principal axes fitted on one window and reused to project another, so both
 * windows share the same coordinate system.
 */
public final class PrincipalComponents {

    private final double[] mean;
    private final double[][] axes;

    private PrincipalComponents(double[] mean, double[][] axes) {
        this.mean = mean;
        this.axes = axes;
    }

    /**
     * Eigen-decomposes the covariance matrix of {@code data} and keeps the
     * {@code components} axes with the largest eigenvalues.
     */
    public static PrincipalComponents fit(double[][] data, int components) {
        int dim = data[0].length;
        int k = Math.min(components, dim);
        double[] mean = VectorStats.centroid(data);

        double[][] centered = new double[data.length][dim];
        for (int r = 0; r < data.length; r++) {
            for (int c = 0; c < dim; c++) {
                centered[r][c] = data[r][c] - mean[c];
            }
        }
        RealMatrix x = new BlockRealMatrix(centered);
        RealMatrix covariance = x.transpose().multiply(x).scalarMultiply(1.0 / Math.max(1, data.length - 1));
        EigenDecomposition eigen = new EigenDecomposition(covariance);

        double[] eigenvalues = eigen.getRealEigenvalues();
        Integer[] order = IntStream.range(0, eigenvalues.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> eigenvalues[i]).reversed());

        double[][] axes = new double[k][];
        for (int i = 0; i < k; i++) {
            RealVector axis = eigen.getEigenvector(order[i]);
            axes[i] = axis.toArray();
        }
        return new PrincipalComponents(mean, axes);
    }

    public int components() {
        return axes.length;
    }

    public double[][] transform(double[][] data) {
        double[][] out = new double[data.length][axes.length];
        for (int r = 0; r < data.length; r++) {
            for (int a = 0; a < axes.length; a++) {
                double sum = 0.0;
                double[] axis = axes[a];
                for (int c = 0; c < axis.length; c++) {
                    sum += (data[r][c] - mean[c]) * axis[c];
                }
                out[r][a] = sum;
            }
        }
        return out;
    }

    /**
     * Projection onto the first axis only.
     */
    public double[] project(double[][] data) {
        double[] out = new double[data.length];
        double[] axis = axes[0];
        for (int r = 0; r < data.length; r++) {
            double sum = 0.0;
            for (int c = 0; c < axis.length; c++) {
                sum += (data[r][c] - mean[c]) * axis[c];
            }
            out[r] = sum;
        }
        return out;
    }
}
