package com.example.driftmonitor.controller;

import com.example.driftmonitor.error.ConfigurationException;
import com.example.driftmonitor.error.InvalidQueryException;
import com.example.driftmonitor.monitor.behavior.BehaviorDriftMonitor;
import com.example.driftmonitor.monitor.behavior.RefusalSample;
import com.example.driftmonitor.service.DriftPipelineService;
import com.example.driftmonitor.service.PipelineRun;
import com.example.driftmonitor.service.RunReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/drift")
public class DriftController {

    private final DriftPipelineService pipelineService;
    private final BehaviorDriftMonitor behaviorMonitor;

    public DriftController(DriftPipelineService pipelineService, BehaviorDriftMonitor behaviorMonitor) {
        this.pipelineService = pipelineService;
        this.behaviorMonitor = behaviorMonitor;
    }

    /**
     * Runs the pipeline synchronously off the event loop. Passing an existing {@code runId}
     * re-runs it without repeating actions already dispatched under that id.
     */
    @PostMapping("/runs")
    public Mono<RunReport> run(@RequestParam(required = false) String runId) {
        return Mono.fromCallable(() -> {
            PipelineRun run = runId == null || runId.isBlank()
                    ? pipelineService.newRun()
                    : pipelineService.newRun(runId);
            return pipelineService.run(run);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<Map<String, Object>> status(@PathVariable String runId) {
        return pipelineService.activeRun(runId)
                .map(run -> ResponseEntity.ok(Map.<String, Object>of(
                        "runId", run.getRunId(),
                        "state", run.getState().name(),
                        "cancelled", run.isCancelled())))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/runs/{runId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String runId) {
        boolean cancelled = pipelineService.cancel(runId);
        return ResponseEntity.status(cancelled ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT)
                .body(Map.of("runId", runId, "cancelled", cancelled));
    }

    @GetMapping("/refusals")
    public Mono<List<RefusalSample>> refusals(@RequestParam(defaultValue = "7") int days,
                                              @RequestParam(defaultValue = "100") int limit) {
        return Mono.fromCallable(() -> behaviorMonitor.recentRefusals(days, limit))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<Map<String, Object>> invalidQuery(InvalidQueryException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, Object>> invalidConfiguration(ConfigurationException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Invalid drift configuration", "violations", e.getViolations()));
    }
}
