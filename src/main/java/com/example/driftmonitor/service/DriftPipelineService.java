package com.example.driftmonitor.service;

import com.example.driftmonitor.action.ActionExecutor;
import com.example.driftmonitor.action.ActionResult;
import com.example.driftmonitor.action.ActionStatus;
import com.example.driftmonitor.config.DriftProperties;
import com.example.driftmonitor.decision.ActionPlan;
import com.example.driftmonitor.decision.CombinedDriftReport;
import com.example.driftmonitor.decision.DriftAction;
import com.example.driftmonitor.decision.DriftDecisionEngine;
import com.example.driftmonitor.metrics.MetricsExporter;
import com.example.driftmonitor.model.DriftWindows;
import com.example.driftmonitor.monitor.DriftMonitor;
import com.example.driftmonitor.monitor.DriftReport;
import com.example.driftmonitor.monitor.MonitorResult;
import com.example.driftmonitor.monitor.accuracy.AccuracyDriftReport;
import com.example.driftmonitor.monitor.behavior.BehaviorDriftReport;
import com.example.driftmonitor.monitor.embedding.EmbeddingDriftReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs the drift pipeline: detect with every monitor, decide on actions, execute them and
 * persist a run report.
 *
 * <p>Monitors are isolated from each other: one failing or timing out is recorded in the
 * report and the remaining monitors still contribute. Likewise one failing action does not
 * stop the others. A run always ends with a written report unless its configuration is
 * invalid, in which case nothing runs at all.
 */
public class DriftPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(DriftPipelineService.class);

    static final DateTimeFormatter RUN_ID_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);
    static final String NO_DRIFT_MESSAGE = "No drift detected - no actions needed";

    private final DriftProperties props;
    private final DriftMonitor<EmbeddingDriftReport> embeddingMonitor;
    private final DriftMonitor<BehaviorDriftReport> behaviorMonitor;
    private final DriftMonitor<AccuracyDriftReport> accuracyMonitor;
    private final DriftDecisionEngine decisionEngine;
    private final ActionExecutor actionExecutor;
    private final MetricsExporter metrics;
    private final RunReportWriter reportWriter;
    private final Clock clock;
    private final ExecutorService monitorExecutor;
    private final Map<String, PipelineRun> activeRuns = new ConcurrentHashMap<>();

    public DriftPipelineService(DriftProperties props,
                                DriftMonitor<EmbeddingDriftReport> embeddingMonitor,
                                DriftMonitor<BehaviorDriftReport> behaviorMonitor,
                                DriftMonitor<AccuracyDriftReport> accuracyMonitor,
                                DriftDecisionEngine decisionEngine,
                                ActionExecutor actionExecutor,
                                MetricsExporter metrics,
                                RunReportWriter reportWriter,
                                Clock clock) {
        this.props = props;
        this.embeddingMonitor = embeddingMonitor;
        this.behaviorMonitor = behaviorMonitor;
        this.accuracyMonitor = accuracyMonitor;
        this.decisionEngine = decisionEngine;
        this.actionExecutor = actionExecutor;
        this.metrics = metrics;
        this.reportWriter = reportWriter;
        this.clock = clock;
        this.monitorExecutor = createExecutorService(props.getPipeline().getThreads());
    }

    private ExecutorService createExecutorService(int threads) {
        int threadCount = threads > 0 ? threads : 3;
        return Executors.newFixedThreadPool(threadCount, r -> {
            Thread t = new Thread(r, "drift-monitor-thread");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates a handle for a new run, identified by its start time and a random suffix so
     * runs started within the same second never share an id.
     */
    public PipelineRun newRun() {
        Instant now = clock.instant();
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return new PipelineRun("drift-" + RUN_ID_STAMP.format(now) + "-" + suffix, now);
    }

    /**
     * Creates a handle that reuses a caller supplied run id; actions already dispatched
     * under that id are skipped.
     */
    public PipelineRun newRun(String runId) {
        return new PipelineRun(runId, clock.instant());
    }

    public RunReport run() {
        return run(newRun());
    }

    public Optional<PipelineRun> activeRun(String runId) {
        return Optional.ofNullable(activeRuns.get(runId));
    }

    public boolean cancel(String runId) {
        PipelineRun run = activeRuns.get(runId);
        return run != null && run.cancel();
    }

    /**
     * @throws com.example.driftmonitor.error.ConfigurationException before any monitor runs
     * @throws com.example.driftmonitor.error.ReportPersistenceException when the report cannot be written
     */
    public RunReport run(PipelineRun run) {
        props.validate();

        if (activeRuns.putIfAbsent(run.getRunId(), run) != null) {
            throw new IllegalStateException("Run " + run.getRunId() + " is already in progress");
        }
        try {
            return execute(run);
        } finally {
            activeRuns.remove(run.getRunId());
        }
    }

    private RunReport execute(PipelineRun run) {
        List<PipelineEvent> events = new ArrayList<>();
        logger.info("Starting drift detection pipeline, run {}", run.getRunId());
        DriftWindows windows = DriftWindows.endingAt(run.getStartTime(),
                props.getWindow().getBaselineDays(), props.getWindow().getCurrentDays());
        Map<String, Object> started = new LinkedHashMap<>();
        started.put("baseline_start", windows.getBaseline().getStart().toString());
        started.put("current_start", windows.getCurrent().getStart().toString());
        started.put("current_end", windows.getCurrent().getEnd().toString());
        record(events, PipelineEvent.PIPELINE_STARTED, started);

        CombinedDriftReport driftReport = null;
        ActionPlan plan = new ActionPlan(List.of(), List.of());
        Map<DriftAction, ActionResult> actionResults = Map.of();

        if (!cancelled(run, events)) {
            run.transition(PipelineState.DETECTING);
            driftReport = detect(windows, events);
        }
        if (!cancelled(run, events)) {
            run.transition(PipelineState.DECIDING);
            plan = decisionEngine.decide(driftReport);
            if (plan.isEmpty()) {
                record(events, PipelineEvent.NO_ACTION, Map.of("message", NO_DRIFT_MESSAGE));
            }
        }
        if (!plan.isEmpty() && !cancelled(run, events)) {
            run.transition(PipelineState.EXECUTING);
            actionResults = actionExecutor.execute(run.getRunId(), plan, windows, run::isCancelled);
            Map<String, Object> executed = new LinkedHashMap<>();
            executed.put("actions", plan.getActions().stream().map(DriftAction::value).collect(Collectors.toList()));
            executed.put("reasons", plan.getReasons());
            executed.put("results", actionResults.entrySet().stream()
                    .collect(Collectors.toMap(e -> e.getKey().value(), e -> e.getValue().getStatus().value(),
                            (a, b) -> a, LinkedHashMap::new)));
            record(events, PipelineEvent.ACTIONS_EXECUTED, executed);
        }

        run.transition(PipelineState.REPORTING);
        if (driftReport != null) {
            metrics.publish(driftReport);
        }
        boolean phaseSkipped = events.stream().anyMatch(e -> PipelineEvent.RUN_CANCELLED.equals(e.getEventType()));
        RunStatus status = classify(phaseSkipped, driftReport, plan, actionResults);
        Instant end = clock.instant();
        double durationSeconds = Duration.between(run.getStartTime(), end).toMillis() / 1000.0;
        record(events, PipelineEvent.PIPELINE_COMPLETE, Map.of("status", status.name(), "duration_seconds", durationSeconds));

        RunReport report = RunReport.builder()
                .runId(run.getRunId())
                .startTime(run.getStartTime())
                .endTime(end)
                .durationSeconds(durationSeconds)
                .status(status)
                .driftReport(driftReport)
                .actionsTaken(plan.getActions())
                .actionResults(Collections.unmodifiableMap(RunReportWriter.byWireName(actionResults)))
                .events(Collections.unmodifiableList(events))
                .build();
        reportWriter.write(report);
        run.transition(PipelineState.DONE);

        logger.info("Pipeline completed in {}s with status {}", durationSeconds, status);
        return report;
    }

    private boolean cancelled(PipelineRun run, List<PipelineEvent> events) {
        if (!run.isCancelled()) {
            return false;
        }
        boolean alreadyRecorded = events.stream().anyMatch(e -> PipelineEvent.RUN_CANCELLED.equals(e.getEventType()));
        if (!alreadyRecorded) {
            record(events, PipelineEvent.RUN_CANCELLED, Map.of("state", run.getState().name()));
        }
        return true;
    }

    CombinedDriftReport detect(DriftWindows windows, List<PipelineEvent> events) {
        MonitorResult<EmbeddingDriftReport> embedding;
        MonitorResult<BehaviorDriftReport> behavior;
        MonitorResult<AccuracyDriftReport> accuracy;

        if (props.getPipeline().isParallelMonitors()) {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(props.getPipeline().getMonitorTimeoutMs());
            CompletableFuture<MonitorResult<EmbeddingDriftReport>> e = submit(embeddingMonitor, windows);
            CompletableFuture<MonitorResult<BehaviorDriftReport>> b = submit(behaviorMonitor, windows);
            CompletableFuture<MonitorResult<AccuracyDriftReport>> a = submit(accuracyMonitor, windows);
            embedding = await(embeddingMonitor.name(), e, deadline);
            behavior = await(behaviorMonitor.name(), b, deadline);
            accuracy = await(accuracyMonitor.name(), a, deadline);
        } else {
            embedding = invoke(embeddingMonitor, windows);
            behavior = invoke(behaviorMonitor, windows);
            accuracy = invoke(accuracyMonitor, windows);
        }

        Map<String, String> errors = new LinkedHashMap<>();
        for (MonitorResult<?> result : List.of(embedding, behavior, accuracy)) {
            if (!result.isSuccess()) {
                errors.put(result.getMonitor(), result.getError());
                record(events, PipelineEvent.MONITOR_FAILED,
                        Map.of("monitor", result.getMonitor(), "error", String.valueOf(result.getError())));
            }
        }

        CombinedDriftReport report = CombinedDriftReport.of(clock.instant(),
                embedding.getReport().orElse(null),
                behavior.getReport().orElse(null),
                accuracy.getReport().orElse(null),
                errors);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("overall_drift_detected", report.isOverallDriftDetected());
        details.put("overall_drift_score", report.getOverallDriftScore());
        details.put("failed_monitors", new ArrayList<>(errors.keySet()));
        record(events, PipelineEvent.DETECTION_COMPLETE, details);
        logger.info("Overall drift detected: {} (score {})", report.isOverallDriftDetected(),
                String.format("%.3f", report.getOverallDriftScore()));
        return report;
    }

    private <R extends DriftReport> CompletableFuture<MonitorResult<R>> submit(DriftMonitor<R> monitor,
                                                                             DriftWindows windows) {
        return CompletableFuture.supplyAsync(() -> invoke(monitor, windows), monitorExecutor);
    }

    private <R extends DriftReport> MonitorResult<R> await(String name, CompletableFuture<MonitorResult<R>> future,
                                                          long deadlineNanos) {
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            logger.warn("Monitor {} timed out after {}ms", name, props.getPipeline().getMonitorTimeoutMs());
            future.cancel(true);
            return MonitorResult.failure(name, "Timed out after " + props.getPipeline().getMonitorTimeoutMs() + "ms",
                    Duration.ofMillis(props.getPipeline().getMonitorTimeoutMs()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return MonitorResult.failure(name, "Interrupted", Duration.ZERO);
        } catch (ExecutionException e) {
            logger.error("Monitor {} failed", name, e.getCause());
            return MonitorResult.failure(name, String.valueOf(e.getCause()), Duration.ZERO);
        }
    }

    private <R extends DriftReport> MonitorResult<R> invoke(DriftMonitor<R> monitor, DriftWindows windows) {
        long startNanos = System.nanoTime();
        try {
            logger.info("Running {} monitor", monitor.name());
            R report = monitor.detect(windows);
            return MonitorResult.success(monitor.name(), report, Duration.ofNanos(System.nanoTime() - startNanos));
        } catch (RuntimeException e) {
            logger.error("{} monitor failed: {}", monitor.name(), e.getMessage(), e);
            return MonitorResult.failure(monitor.name(), e.getMessage(), Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    /**
     * A cancel only counts when it cut work short: a skipped phase or an action skipped for
     * cancellation. A cancel arriving after the last dispatch leaves the outcome as it is.
     */
    static RunStatus classify(boolean phaseSkipped, CombinedDriftReport report, ActionPlan plan,
                              Map<DriftAction, ActionResult> results) {
        boolean actionSkipped = results.values().stream().anyMatch(r -> r.getStatus() == ActionStatus.SKIPPED
                && ActionExecutor.CANCELLED_REASON.equals(r.getError()));
        if (phaseSkipped || actionSkipped) {
            return RunStatus.CANCELLED;
        }
        if (!plan.isEmpty()) {
            boolean anyFailed = results.values().stream().anyMatch(r -> r.getStatus() == ActionStatus.FAILED);
            return anyFailed ? RunStatus.DRIFT_PARTIALLY_ACTIONED : RunStatus.DRIFT_ACTIONED;
        }
        if (!report.isComplete()) {
            return RunStatus.DETECTION_INCOMPLETE;
        }
        return report.isOverallDriftDetected() ? RunStatus.DRIFT_NO_ACTION : RunStatus.NO_DRIFT;
    }

    private void record(List<PipelineEvent> events, String type, Map<String, Object> details) {
        events.add(new PipelineEvent(clock.instant(), type, details));
        logger.info("EVENT: {} - {}", type, details);
    }

    public void shutdown() {
        monitorExecutor.shutdownNow();
    }
}
