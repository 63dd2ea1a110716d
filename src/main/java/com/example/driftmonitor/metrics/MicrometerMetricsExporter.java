package com.example.driftmonitor.metrics;

import com.example.driftmonitor.decision.CombinedDriftReport;
import com.example.driftmonitor.monitor.PeriodSummary;
import com.example.driftmonitor.monitor.accuracy.AccuracyDriftReport;
import com.example.driftmonitor.monitor.accuracy.AccuracyPeriodMetrics;
import com.example.driftmonitor.monitor.behavior.BehaviorDriftReport;
import com.example.driftmonitor.monitor.behavior.BehaviorMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Publishes drift metrics to the Micrometer registry. With the Prometheus registry on the
 * classpath they are scraped from {@code /actuator/prometheus} as {@code drift_embedding_score},
 * {@code retrain_events_total}, {@code api_cost_usd_total} and so on.
 */
@Component
public class MicrometerMetricsExporter implements MetricsExporter {

    private static final Logger logger = LoggerFactory.getLogger(MicrometerMetricsExporter.class);

    private final AtomicReference<Double> embeddingScore = new AtomicReference<>(0.0);
    private final AtomicReference<Double> behaviorScore = new AtomicReference<>(0.0);
    private final AtomicReference<Double> accuracyScore = new AtomicReference<>(0.0);
    private final AtomicReference<Double> overallScore = new AtomicReference<>(0.0);
    private final AtomicReference<Double> modelAccuracy = new AtomicReference<>(0.0);
    private final AtomicReference<Double> refusalRate = new AtomicReference<>(0.0);
    private final AtomicReference<Double> toxicityRate = new AtomicReference<>(0.0);
    private final DoubleAdder apiCost = new DoubleAdder();

    private final Counter retrainEvents;
    private final Counter reindexEvents;

    public MicrometerMetricsExporter(MeterRegistry registry) {
        gauge(registry, "drift.embedding.score", "Embedding drift score", embeddingScore);
        gauge(registry, "drift.behavior.score", "Behavior drift score", behaviorScore);
        gauge(registry, "drift.accuracy.score", "Accuracy drift score", accuracyScore);
        gauge(registry, "drift.overall.score", "Overall drift score", overallScore);
        gauge(registry, "model.accuracy", "Mean evaluation accuracy of the current window", modelAccuracy);
        gauge(registry, "model.refusal.rate", "Refusal rate of the current window", refusalRate);
        gauge(registry, "model.toxicity.rate", "Toxicity rate of the current window", toxicityRate);

        this.retrainEvents = Counter.builder("retrain.events")
                .description("Fine-tune jobs triggered")
                .register(registry);
        this.reindexEvents = Counter.builder("reindex.events")
                .description("Document re-index runs triggered")
                .register(registry);
        FunctionCounter.builder("api.cost.usd", apiCost, DoubleAdder::sum)
                .description("Cost in USD reported by action runners")
                .register(registry);
    }

    private static void gauge(MeterRegistry registry, String name, String description, AtomicReference<Double> value) {
        Gauge.builder(name, value, ref -> ref.get())
                .description(description)
                .register(registry);
    }

    @Override
    public void publish(CombinedDriftReport report) {
        if (report.getEmbeddingDrift() != null && report.getEmbeddingDrift().getDriftScore() != null) {
            embeddingScore.set(report.getEmbeddingDrift().getDriftScore());
        }
        BehaviorDriftReport behavior = report.getBehaviorDrift();
        if (behavior != null && behavior.getDriftScore() != null) {
            behaviorScore.set(behavior.getDriftScore());
            PeriodSummary<BehaviorMetrics> current = behavior.getCurrentPeriod();
            if (current != null && current.getMetrics() != null) {
                refusalRate.set(current.getMetrics().getRefusalRate());
                toxicityRate.set(current.getMetrics().getToxicityRate());
            }
        }
        AccuracyDriftReport accuracy = report.getAccuracyDrift();
        if (accuracy != null && accuracy.getDriftScore() != null) {
            accuracyScore.set(accuracy.getDriftScore());
            PeriodSummary<AccuracyPeriodMetrics> current = accuracy.getCurrentPeriod();
            if (current != null && current.getMetrics() != null
                    && current.getMetrics().getEvaluationMetrics() != null
                    && current.getMetrics().getEvaluationMetrics().getAvgAccuracy() != null) {
                modelAccuracy.set(current.getMetrics().getEvaluationMetrics().getAvgAccuracy());
            }
        }
        overallScore.set(report.getOverallDriftScore());
        logger.debug("Published drift metrics: overall={}", report.getOverallDriftScore());
    }

    @Override
    public void recordRetrain() {
        retrainEvents.increment();
    }

    @Override
    public void recordReindex() {
        reindexEvents.increment();
    }

    @Override
    public void addApiCost(double usd) {
        if (usd < 0 || Double.isNaN(usd)) {
            logger.warn("Ignoring invalid API cost: {}", usd);
            return;
        }
        apiCost.add(usd);
    }
}
