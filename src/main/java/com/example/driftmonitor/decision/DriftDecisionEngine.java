package com.example.driftmonitor.decision;

import com.example.driftmonitor.monitor.accuracy.AccuracyDriftReport;
import com.example.driftmonitor.monitor.behavior.BehaviorDriftReport;
import com.example.driftmonitor.monitor.embedding.EmbeddingDriftReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps raised drift signals to corrective actions through a rule table.
 * Rules are evaluated independently; an action selected by several rules appears once,
 * at the position of the first rule that selected it.
 */
public class DriftDecisionEngine {

    private static final Logger logger = LoggerFactory.getLogger(DriftDecisionEngine.class);

    public static final List<DecisionRule> DEFAULT_RULES = List.of(
            DecisionRule.of(EmbeddingDriftReport.SIGNAL, DriftAction.REINDEX_DOCUMENTS,
                    "Embedding drift detected: re-index documents"),
            DecisionRule.of(BehaviorDriftReport.REFUSAL_SIGNAL, DriftAction.FINE_TUNE_MODEL,
                    "High refusal rate: fine-tune model"),
            DecisionRule.of(BehaviorDriftReport.TOXICITY_SIGNAL, DriftAction.UPDATE_SAFETY_FILTERS,
                    "High toxicity rate: update safety filters"),
            DecisionRule.of(AccuracyDriftReport.SIGNAL, DriftAction.FINE_TUNE_MODEL,
                    "Accuracy degradation: fine-tune model")
    );

    private final List<DecisionRule> rules;

    public DriftDecisionEngine() {
        this(DEFAULT_RULES);
    }

    public DriftDecisionEngine(List<DecisionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public ActionPlan decide(CombinedDriftReport report) {
        Set<DriftAction> actions = new LinkedHashSet<>();
        List<String> reasons = new ArrayList<>();
        for (DecisionRule rule : rules) {
            if (report.signal(rule.getSignal())) {
                logger.info("-> {}", rule.getReason());
                actions.add(rule.getAction());
                reasons.add(rule.getReason());
            }
        }
        if (actions.isEmpty()) {
            logger.info("No drift detected - no actions needed");
        }
        return new ActionPlan(List.copyOf(actions), List.copyOf(reasons));
    }

    public List<DecisionRule> rules() {
        return rules;
    }
}
