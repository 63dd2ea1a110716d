package com.example.driftmonitor.monitor.behavior;

import com.example.driftmonitor.model.InteractionRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Counts and rates over the interactions of one window.
 */
@Value
@Builder
public class BehaviorMetrics {
    int totalInteractions;
    int refusalCount;
    double refusalRate;
    int toxicityCount;
    double toxicityRate;
    int errorCount;
    double errorRate;
    /** Mean character length of non-null responses, 0 when there are none. */
    double avgResponseLength;

    public static BehaviorMetrics of(List<InteractionRecord> interactions) {
        int total = interactions.size();
        int refusals = 0;
        int toxic = 0;
        int errors = 0;
        long lengthSum = 0;
        int responses = 0;
        for (InteractionRecord r : interactions) {
            if (r.isRefusalFlag()) refusals++;
            if (r.isToxicityFlag()) toxic++;
            if (r.isErrorFlag()) errors++;
            if (r.getModelResponse() != null) {
                lengthSum += r.getModelResponse().length();
                responses++;
            }
        }
        return BehaviorMetrics.builder()
                .totalInteractions(total)
                .refusalCount(refusals)
                .refusalRate(total == 0 ? 0.0 : (double) refusals / total)
                .toxicityCount(toxic)
                .toxicityRate(total == 0 ? 0.0 : (double) toxic / total)
                .errorCount(errors)
                .errorRate(total == 0 ? 0.0 : (double) errors / total)
                .avgResponseLength(responses == 0 ? 0.0 : (double) lengthSum / responses)
                .build();
    }
}
