package com.example.driftmonitor.action;

import com.example.driftmonitor.action.runner.FineTuneRunner;
import com.example.driftmonitor.decision.DriftAction;
import com.example.driftmonitor.model.DriftWindows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public class FineTuneDispatcher implements ActionDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(FineTuneDispatcher.class);

    private final FineTuneRunner runner;

    public FineTuneDispatcher(FineTuneRunner runner) {
        this.runner = runner;
    }

    @Override
    public DriftAction action() {
        return DriftAction.FINE_TUNE_MODEL;
    }

    @Override
    public Map<String, Object> dispatch(DriftWindows windows) {
        Map<String, Object> details = Dispatchers.require(action(), runner.triggerFineTune(windows),
                FineTuneRunner.JOB_ID);
        logger.info("Fine-tuning job triggered: {}", details.get(FineTuneRunner.JOB_ID));
        return details;
    }
}
