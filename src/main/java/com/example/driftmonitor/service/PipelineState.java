package com.example.driftmonitor.service;

/**
 * Phases of one pipeline run, in order. A run only ever moves forward; a cancelled run
 * jumps straight to {@link #REPORTING}.
 */
public enum PipelineState {
    INIT, DETECTING, DECIDING, EXECUTING, REPORTING, DONE;

    public boolean canTransitionTo(PipelineState next) {
        return next.ordinal() > ordinal();
    }
}
