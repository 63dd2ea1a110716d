package com.example.driftmonitor.monitor;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of invoking one monitor: either its report or the error that stopped it.
 */
public final class MonitorResult<R extends DriftReport> {

    private final String monitor;
    private final R report;
    private final String error;
    private final Duration elapsed;

    private MonitorResult(String monitor, R report, String error, Duration elapsed) {
        this.monitor = monitor;
        this.report = report;
        this.error = error;
        this.elapsed = elapsed;
    }

    public static <R extends DriftReport> MonitorResult<R> success(String monitor, R report, Duration elapsed) {
        return new MonitorResult<>(monitor, report, null, elapsed);
    }

    public static <R extends DriftReport> MonitorResult<R> failure(String monitor, String error, Duration elapsed) {
        return new MonitorResult<>(monitor, null, error, elapsed);
    }

    public boolean isSuccess() { return report != null; }
    public String getMonitor() { return monitor; }
    public Optional<R> getReport() { return Optional.ofNullable(report); }
    public String getError() { return error; }
    public Duration getElapsed() { return elapsed; }
}
