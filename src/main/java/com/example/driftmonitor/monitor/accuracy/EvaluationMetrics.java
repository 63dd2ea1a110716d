package com.example.driftmonitor.monitor.accuracy;

import com.example.driftmonitor.model.EvaluationRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.List;
import java.util.function.Function;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EvaluationMetrics {
    Double avgAccuracy;
    Double avgPrecision;
    Double avgRecall;
    Double avgF1;
    int evaluationCount;

    public static EvaluationMetrics of(List<EvaluationRecord> evaluations) {
        return EvaluationMetrics.builder()
                .avgAccuracy(mean(evaluations, EvaluationRecord::getAccuracy))
                .avgPrecision(mean(evaluations, EvaluationRecord::getPrecision))
                .avgRecall(mean(evaluations, EvaluationRecord::getRecall))
                .avgF1(mean(evaluations, EvaluationRecord::getF1Score))
                .evaluationCount(evaluations.size())
                .build();
    }

    /** Mean of the non-null values, {@code null} when there are none. */
    static Double mean(List<EvaluationRecord> evaluations, Function<EvaluationRecord, Double> field) {
        SummaryStatistics stats = new SummaryStatistics();
        for (EvaluationRecord e : evaluations) {
            Double v = field.apply(e);
            if (v != null) {
                stats.addValue(v);
            }
        }
        return stats.getN() == 0 ? null : stats.getMean();
    }
}
