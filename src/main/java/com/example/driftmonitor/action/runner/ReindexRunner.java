package com.example.driftmonitor.action.runner;

import com.example.driftmonitor.model.DriftWindows;

import java.util.Map;

public interface ReindexRunner {

    String DOCUMENTS_PROCESSED = "documents_processed";

    /**
     * Re-embeds and re-indexes the document corpus.
     *
     * @return runner details, at least {@value #DOCUMENTS_PROCESSED}
     */
    Map<String, Object> reindex(DriftWindows windows);
}
