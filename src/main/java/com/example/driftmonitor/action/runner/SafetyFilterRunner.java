package com.example.driftmonitor.action.runner;

import com.example.driftmonitor.model.DriftWindows;

import java.util.Map;

public interface SafetyFilterRunner {

    String STATUS = "status";

    /** @return runner details, at least {@value #STATUS} */
    Map<String, Object> updateSafetyFilters(DriftWindows windows);
}
