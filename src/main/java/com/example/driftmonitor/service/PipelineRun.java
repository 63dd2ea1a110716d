package com.example.driftmonitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caller-held handle of a run. {@link #cancel()} is honoured between phases and between
 * actions; a dispatch already in flight is never interrupted.
 */
public class PipelineRun {

    private static final Logger logger = LoggerFactory.getLogger(PipelineRun.class);

    private final String runId;
    private final Instant startTime;
    private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.INIT);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public PipelineRun(String runId, Instant startTime) {
        this.runId = runId;
        this.startTime = startTime;
    }

    public String getRunId() { return runId; }
    public Instant getStartTime() { return startTime; }
    public PipelineState getState() { return state.get(); }
    public boolean isCancelled() { return cancelled.get(); }

    /**
     * @return false when the run already finished reporting
     */
    public boolean cancel() {
        PipelineState current = state.get();
        if (current == PipelineState.REPORTING || current == PipelineState.DONE) {
            return false;
        }
        cancelled.set(true);
        logger.info("Cancellation requested for run {} in state {}", runId, current);
        return true;
    }

    void transition(PipelineState next) {
        PipelineState current = state.get();
        if (!current.canTransitionTo(next) || !state.compareAndSet(current, next)) {
            throw new IllegalStateException("Run " + runId + " cannot move from " + current + " to " + next);
        }
        logger.debug("Run {}: {} -> {}", runId, current, next);
    }
}
