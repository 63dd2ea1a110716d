package com.example.driftmonitor.monitor;

public final class DriftScores {

    private DriftScores() {
    }

    public static double clip(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    public static double ratio(double value, double threshold) {
        return threshold > 0 ? value / threshold : 0.0;
    }
}
