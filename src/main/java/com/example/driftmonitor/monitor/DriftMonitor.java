package com.example.driftmonitor.monitor;

import com.example.driftmonitor.model.DriftWindows;

/**
 * A read-only drift estimator over the baseline and current windows.
 */
public interface DriftMonitor<R extends DriftReport> {

    String name();

    /**
     * @throws com.example.driftmonitor.error.DataSourceException when its log reads fail
     */
    R detect(DriftWindows windows);
}
