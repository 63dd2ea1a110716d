package com.example.driftmonitor.monitor.accuracy;

import com.example.driftmonitor.model.InteractionRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.List;

/**
 * User feedback over the interactions that carry a score.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeedbackMetrics {

    static final double POSITIVE_MIN = 4.0;
    static final double NEGATIVE_MAX = 2.0;

    Double avgRating;
    int feedbackCount;
    int positiveCount;
    int negativeCount;
    double positiveRate;
    double negativeRate;

    public static FeedbackMetrics of(List<InteractionRecord> interactions) {
        SummaryStatistics stats = new SummaryStatistics();
        int positive = 0;
        int negative = 0;
        for (InteractionRecord r : interactions) {
            Double score = r.getUserFeedbackScore();
            if (score == null) {
                continue;
            }
            stats.addValue(score);
            if (score >= POSITIVE_MIN) positive++;
            if (score <= NEGATIVE_MAX) negative++;
        }
        int count = (int) stats.getN();
        return FeedbackMetrics.builder()
                .avgRating(count == 0 ? null : stats.getMean())
                .feedbackCount(count)
                .positiveCount(positive)
                .negativeCount(negative)
                .positiveRate(count == 0 ? 0.0 : (double) positive / count)
                .negativeRate(count == 0 ? 0.0 : (double) negative / count)
                .build();
    }
}
