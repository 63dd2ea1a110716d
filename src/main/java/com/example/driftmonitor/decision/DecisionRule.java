package com.example.driftmonitor.decision;

import lombok.Value;

/**
 * One row of the decision table: when {@code signal} is raised, take {@code action}.
 */
@Value
public class DecisionRule {
    String signal;
    DriftAction action;
    String reason;

    public static DecisionRule of(String signal, DriftAction action, String reason) {
        return new DecisionRule(signal, action, reason);
    }
}
