package com.example.driftmonitor.config;

import com.example.driftmonitor.action.ActionExecutor;
import com.example.driftmonitor.action.ActionLedger;
import com.example.driftmonitor.action.FineTuneDispatcher;
import com.example.driftmonitor.action.ReindexDispatcher;
import com.example.driftmonitor.action.SafetyFilterDispatcher;
import com.example.driftmonitor.action.runner.HttpActionRunner;
import com.example.driftmonitor.decision.DriftDecisionEngine;
import com.example.driftmonitor.kv.KvClient;
import com.example.driftmonitor.metrics.MetricsExporter;
import com.example.driftmonitor.monitor.accuracy.AccuracyDriftMonitor;
import com.example.driftmonitor.monitor.behavior.BehaviorDriftMonitor;
import com.example.driftmonitor.monitor.embedding.EmbeddingDriftDetector;
import com.example.driftmonitor.repo.DriftEventRepo;
import com.example.driftmonitor.service.DriftPipelineService;
import com.example.driftmonitor.service.RunReportWriter;
import com.example.driftmonitor.store.LogAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the pipeline components. Each one receives only its own slice of {@link DriftProperties}.
 */
@Configuration
public class DriftMonitorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EmbeddingDriftDetector embeddingDriftDetector(LogAccessor logs, DriftProperties props, Clock clock) {
        return new EmbeddingDriftDetector(logs, props.getEmbedding(), props.getQuery().getMaxRows(), clock);
    }

    @Bean
    public BehaviorDriftMonitor behaviorDriftMonitor(LogAccessor logs, DriftProperties props, Clock clock) {
        return new BehaviorDriftMonitor(logs, props.getBehavior(), props.getQuery().getMaxRows(), clock);
    }

    @Bean
    public AccuracyDriftMonitor accuracyDriftMonitor(LogAccessor logs, DriftProperties props, Clock clock) {
        return new AccuracyDriftMonitor(logs, props.getAccuracy(), props.getQuery().getMaxRows(), clock);
    }

    @Bean
    public DriftDecisionEngine driftDecisionEngine() {
        return new DriftDecisionEngine();
    }

    @Bean
    public HttpActionRunner httpActionRunner(WebClient.Builder webClientBuilder, DriftProperties props) {
        return new HttpActionRunner(webClientBuilder.build(), props.getActions());
    }

    @Bean
    public ActionLedger actionLedger(KvClient kvClient, DriftProperties props) {
        return new ActionLedger(kvClient, Duration.ofHours(props.getActions().getLedgerTtlHours()));
    }

    @Bean
    public ActionExecutor actionExecutor(HttpActionRunner runner, ActionLedger ledger, MetricsExporter metrics,
                                         Clock clock) {
        return new ActionExecutor(List.of(
                new ReindexDispatcher(runner),
                new FineTuneDispatcher(runner),
                new SafetyFilterDispatcher(runner)), ledger, metrics, clock);
    }

    @Bean
    public RunReportWriter runReportWriter(ObjectMapper objectMapper, DriftEventRepo driftEventRepo,
                                           DriftProperties props) {
        return new RunReportWriter(objectMapper, driftEventRepo, Path.of(props.getReport().getDirectory()));
    }

    @Bean(destroyMethod = "shutdown")
    public DriftPipelineService driftPipelineService(DriftProperties props,
                                                     EmbeddingDriftDetector embeddingDriftDetector,
                                                     BehaviorDriftMonitor behaviorDriftMonitor,
                                                     AccuracyDriftMonitor accuracyDriftMonitor,
                                                     DriftDecisionEngine driftDecisionEngine,
                                                     ActionExecutor actionExecutor,
                                                     MetricsExporter metrics,
                                                     RunReportWriter runReportWriter,
                                                     Clock clock) {
        return new DriftPipelineService(props, embeddingDriftDetector, behaviorDriftMonitor, accuracyDriftMonitor,
                driftDecisionEngine, actionExecutor, metrics, runReportWriter, clock);
    }
}
