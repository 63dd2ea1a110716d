package com.example.driftmonitor.monitor.embedding;

/**
 * PSI between two one-dimensional samples, binned on the baseline's own range.
 */
public final class PopulationStabilityIndex {

    public static final double HIGH = 0.2;
    public static final double MODERATE = 0.1;

    private PopulationStabilityIndex() {
    }

    /**
     * Equal-width bins over [min, max] of {@code baseline}; the last bin is closed.
     * Values outside that range are not counted but still weigh in the denominators.
     * Every bin gets +1 Laplace smoothing.
     */
    public static double compute(double[] baseline, double[] current, int bins) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : baseline) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }

        long[] baselineCounts = histogram(baseline, min, max, bins);
        long[] currentCounts = histogram(current, min, max, bins);

        double psi = 0.0;
        for (int b = 0; b < bins; b++) {
            double baselinePct = (baselineCounts[b] + 1.0) / (baseline.length + bins);
            double currentPct = (currentCounts[b] + 1.0) / (current.length + bins);
            psi += (currentPct - baselinePct) * Math.log(currentPct / baselinePct);
        }
        return psi;
    }

    public static String level(double psi) {
        if (psi > HIGH) return "high";
        if (psi > MODERATE) return "moderate";
        return "low";
    }

    static long[] histogram(double[] values, double min, double max, int bins) {
        long[] counts = new long[bins];
        double width = (max - min) / bins;
        for (double v : values) {
            if (v < min || v > max) {
                continue;
            }
            int bin = width == 0.0 ? 0 : (int) ((v - min) / width);
            counts[Math.min(bin, bins - 1)]++;
        }
        return counts;
    }
}
