package com.example.driftmonitor.decision;

import lombok.Value;

import java.util.List;

/**
 * Ordered, duplicate-free actions decided for one run, with the reasons that selected them.
 */
@Value
public class ActionPlan {
    List<DriftAction> actions;
    List<String> reasons;

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    public boolean contains(DriftAction action) {
        return actions.contains(action);
    }
}
