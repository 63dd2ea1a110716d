package com.example.driftmonitor.monitor.embedding;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PsiResult {
    double psi;
    /** low, moderate or high */
    String driftLevel;
    int numBins;
    boolean driftDetected;

    public static PsiResult of(double psi, int numBins) {
        return PsiResult.builder()
                .psi(psi)
                .driftLevel(PopulationStabilityIndex.level(psi))
                .numBins(numBins)
                .driftDetected(psi > PopulationStabilityIndex.HIGH)
                .build();
    }
}
