package com.example.driftmonitor.monitor.embedding;

import com.example.driftmonitor.model.EmbeddingType;
import com.example.driftmonitor.monitor.DriftReport;
import com.example.driftmonitor.monitor.PeriodSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmbeddingDriftReport implements DriftReport {

    public static final String SIGNAL = "embedding_drift";

    Instant timestamp;
    EmbeddingType embeddingType;
    PeriodSummary<Void> baselinePeriod;
    PeriodSummary<Void> currentPeriod;
    boolean driftDetected;
    Double driftScore;
    boolean insufficientData;
    String error;

    CentroidDistanceResult centroidDistance;
    VarianceChangeResult varianceChange;
    ClusterDriftResult clusterAnalysis;
    PsiResult populationStabilityIndex;

    @Override
    public Map<String, Boolean> signals() {
        return Map.of(SIGNAL, driftDetected);
    }
}
