package com.example.driftmonitor.action.runner;

import com.example.driftmonitor.model.DriftWindows;

import java.util.Map;

public interface FineTuneRunner {

    String JOB_ID = "job_id";

    /**
     * Submits a fine-tuning job built from the current window's interactions.
     *
     * @return runner details, at least {@value #JOB_ID}
     */
    Map<String, Object> triggerFineTune(DriftWindows windows);
}
