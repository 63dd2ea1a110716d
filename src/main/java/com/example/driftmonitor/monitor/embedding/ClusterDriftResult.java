package com.example.driftmonitor.monitor.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClusterDriftResult {

    public static final String INSUFFICIENT_SAMPLES = "insufficient_samples";

    /** Set when clustering was not attempted. */
    String reason;
    Double baselineSilhouette;
    Double currentSilhouette;
    Double silhouetteChange;
    /** Shift between same-indexed centroids; drives the verdict. */
    Double avgCentroidShift;
    /** Shift after pairing nearest centroids. */
    Double matchedCentroidShift;
    String centroidMatching;
    String alignmentWarning;
    int numClusters;
    Integer numComponents;
    boolean driftDetected;
    String driftReason;

    public static ClusterDriftResult skipped(String reason, int numClusters) {
        return ClusterDriftResult.builder().reason(reason).numClusters(numClusters).driftDetected(false).build();
    }

    public boolean isSkipped() {
        return reason != null;
    }
}
