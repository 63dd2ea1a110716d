package com.example.driftmonitor.action;

import com.example.driftmonitor.action.runner.SafetyFilterRunner;
import com.example.driftmonitor.decision.DriftAction;
import com.example.driftmonitor.model.DriftWindows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public class SafetyFilterDispatcher implements ActionDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(SafetyFilterDispatcher.class);

    private final SafetyFilterRunner runner;

    public SafetyFilterDispatcher(SafetyFilterRunner runner) {
        this.runner = runner;
    }

    @Override
    public DriftAction action() {
        return DriftAction.UPDATE_SAFETY_FILTERS;
    }

    @Override
    public Map<String, Object> dispatch(DriftWindows windows) {
        Map<String, Object> details = Dispatchers.require(action(), runner.updateSafetyFilters(windows),
                SafetyFilterRunner.STATUS);
        logger.info("Safety filters updated: {}", details.get(SafetyFilterRunner.STATUS));
        return details;
    }
}
