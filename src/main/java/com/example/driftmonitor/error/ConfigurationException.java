package com.example.driftmonitor.error;

import java.util.List;

/**
 * Invalid drift configuration. Fatal: raised before any monitor runs.
 */
public class ConfigurationException extends DriftMonitorException {

    private final List<String> violations;

    public ConfigurationException(List<String> violations) {
        super("Invalid drift configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
