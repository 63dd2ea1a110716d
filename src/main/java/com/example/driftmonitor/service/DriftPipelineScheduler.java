package com.example.driftmonitor.service;

import com.example.driftmonitor.error.DriftMonitorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic pipeline runs, enabled with {@code drift.pipeline.schedule-enabled}.
 */
@Service
@ConditionalOnProperty(prefix = "drift.pipeline", name = "schedule-enabled", havingValue = "true")
public class DriftPipelineScheduler {

    private static final Logger logger = LoggerFactory.getLogger(DriftPipelineScheduler.class);

    private final DriftPipelineService pipelineService;

    public DriftPipelineScheduler(DriftPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Scheduled(cron = "${drift.pipeline.cron:0 0 2 * * *}")
    public void run() {
        try {
            RunReport report = pipelineService.run();
            logger.info("Scheduled run {} finished with status {}", report.getRunId(), report.getStatus());
        } catch (DriftMonitorException e) {
            // keep the schedule alive; the next tick gets a fresh run
            logger.error("Scheduled drift run failed: {}", e.getMessage(), e);
        }
    }
}
