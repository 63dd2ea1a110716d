package com.example.driftmonitor.mcp;

import com.example.driftmonitor.config.DriftProperties;
import com.example.driftmonitor.model.DriftEvent;
import com.example.driftmonitor.model.DriftWindows;
import com.example.driftmonitor.model.EmbeddingType;
import com.example.driftmonitor.monitor.accuracy.AccuracyDriftMonitor;
import com.example.driftmonitor.monitor.accuracy.AccuracyDriftReport;
import com.example.driftmonitor.monitor.behavior.BehaviorDriftMonitor;
import com.example.driftmonitor.monitor.behavior.BehaviorDriftReport;
import com.example.driftmonitor.monitor.behavior.RefusalDetector;
import com.example.driftmonitor.monitor.behavior.RefusalSample;
import com.example.driftmonitor.monitor.embedding.EmbeddingDriftDetector;
import com.example.driftmonitor.monitor.embedding.EmbeddingDriftReport;
import com.example.driftmonitor.repo.DriftEventRepo;
import com.example.driftmonitor.service.DriftPipelineService;
import com.example.driftmonitor.service.RunReport;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class DriftTools {

    private final DriftPipelineService pipelineService;
    private final EmbeddingDriftDetector embeddingDetector;
    private final BehaviorDriftMonitor behaviorMonitor;
    private final AccuracyDriftMonitor accuracyMonitor;
    private final DriftEventRepo driftEventRepo;
    private final DriftProperties props;
    private final Clock clock;

    public DriftTools(DriftPipelineService pipelineService,
                      EmbeddingDriftDetector embeddingDetector,
                      BehaviorDriftMonitor behaviorMonitor,
                      AccuracyDriftMonitor accuracyMonitor,
                      DriftEventRepo driftEventRepo,
                      DriftProperties props,
                      Clock clock) {
        this.pipelineService = pipelineService;
        this.embeddingDetector = embeddingDetector;
        this.behaviorMonitor = behaviorMonitor;
        this.accuracyMonitor = accuracyMonitor;
        this.driftEventRepo = driftEventRepo;
        this.props = props;
        this.clock = clock;
    }

    @Tool(description = "Run the full drift pipeline (detect, decide, act, report). Optional runId re-runs an earlier run without repeating its actions")
    public RunReport drift_run(String runId) {
        if (runId == null || runId.isBlank()) {
            return pipelineService.run();
        }
        return pipelineService.run(pipelineService.newRun(runId));
    }

    @Tool(description = "Cancel an in-progress drift run by id")
    public Map<String, Object> drift_cancel(String runId) {
        return Map.of("runId", runId, "cancelled", pipelineService.cancel(runId));
    }

    @Tool(description = "Detect embedding drift for an embedding type: query, doc or all (default from configuration)")
    public EmbeddingDriftReport drift_embedding(String embeddingType) {
        EmbeddingType type = embeddingType == null || embeddingType.isBlank()
                ? props.getEmbedding().getEmbeddingType()
                : EmbeddingType.fromValue(embeddingType);
        return embeddingDetector.detect(windows(), type);
    }

    @Tool(description = "Detect behavior drift: refusal, toxicity and error rates and response length")
    public BehaviorDriftReport drift_behavior() {
        return behaviorMonitor.detect(windows());
    }

    @Tool(description = "Detect accuracy drift: evaluation accuracy, user feedback and task success")
    public AccuracyDriftReport drift_accuracy() {
        return accuracyMonitor.detect(windows());
    }

    @Tool(description = "List the most recent refusal-flagged interactions of the last N days with the refusal phrase each matches")
    public List<RefusalSample> drift_refusals(Integer days, Integer limit) {
        int d = (days == null || days <= 0) ? 7 : days;
        int l = (limit == null || limit <= 0) ? 100 : limit;
        return behaviorMonitor.recentRefusals(d, l);
    }

    @Tool(description = "List the phrases used to recognise refusals")
    public Map<String, Object> drift_refusal_patterns() {
        return Map.of("patterns", RefusalDetector.patterns());
    }

    @Tool(description = "List the 20 most recent drift run summaries")
    public Map<String, Object> drift_recent_runs() {
        List<DriftEvent> events = driftEventRepo.findTop20ByOrderByTimestampDesc();
        Map<String, Object> result = new HashMap<>();
        result.put("count", events.size());
        result.put("runs", events);
        return result;
    }

    private DriftWindows windows() {
        return DriftWindows.endingAt(clock.instant(),
                props.getWindow().getBaselineDays(), props.getWindow().getCurrentDays());
    }
}
