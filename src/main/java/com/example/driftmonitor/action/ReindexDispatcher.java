package com.example.driftmonitor.action;

import com.example.driftmonitor.action.runner.ReindexRunner;
import com.example.driftmonitor.decision.DriftAction;
import com.example.driftmonitor.model.DriftWindows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public class ReindexDispatcher implements ActionDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ReindexDispatcher.class);

    private final ReindexRunner runner;

    public ReindexDispatcher(ReindexRunner runner) {
        this.runner = runner;
    }

    @Override
    public DriftAction action() {
        return DriftAction.REINDEX_DOCUMENTS;
    }

    @Override
    public Map<String, Object> dispatch(DriftWindows windows) {
        Map<String, Object> details = Dispatchers.require(action(), runner.reindex(windows),
                ReindexRunner.DOCUMENTS_PROCESSED);
        logger.info("Re-indexing completed: {} documents", details.get(ReindexRunner.DOCUMENTS_PROCESSED));
        return details;
    }
}
