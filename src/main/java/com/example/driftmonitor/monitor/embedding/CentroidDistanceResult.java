package com.example.driftmonitor.monitor.embedding;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CentroidDistanceResult {
    double euclideanDistance;
    double cosineDistance;
    double threshold;
    boolean driftDetected;
}
