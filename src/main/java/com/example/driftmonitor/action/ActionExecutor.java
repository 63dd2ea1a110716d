package com.example.driftmonitor.action;

import com.example.driftmonitor.decision.ActionPlan;
import com.example.driftmonitor.decision.DriftAction;
import com.example.driftmonitor.metrics.MetricsExporter;
import com.example.driftmonitor.model.DriftWindows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Runs the actions of a plan in order. Every action gets exactly one attempt and a failure
 * never prevents the remaining actions from running.
 */
public class ActionExecutor {

    private static final Logger logger = LoggerFactory.getLogger(ActionExecutor.class);

    static final String COST_USD = "cost_usd";
    public static final String CANCELLED_REASON = "Run cancelled";

    private final Map<DriftAction, ActionDispatcher> dispatchers = new EnumMap<>(DriftAction.class);
    private final ActionLedger ledger;
    private final MetricsExporter metrics;
    private final Clock clock;

    public ActionExecutor(List<ActionDispatcher> dispatchers, ActionLedger ledger, MetricsExporter metrics,
                          Clock clock) {
        for (ActionDispatcher d : dispatchers) {
            this.dispatchers.put(d.action(), d);
        }
        this.ledger = ledger;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @param cancelled checked before each dispatch; once true the rest of the plan is skipped
     * @return one result per planned action, in plan order
     */
    public Map<DriftAction, ActionResult> execute(String runId, ActionPlan plan, DriftWindows windows,
                                                  BooleanSupplier cancelled) {
        Map<DriftAction, ActionResult> results = new LinkedHashMap<>();
        for (DriftAction action : plan.getActions()) {
            if (cancelled.getAsBoolean()) {
                results.put(action, ActionResult.skipped(action, CANCELLED_REASON, clock.instant()));
                continue;
            }
            results.put(action, executeOne(runId, action, windows));
        }
        return Collections.unmodifiableMap(results);
    }

    private ActionResult executeOne(String runId, DriftAction action, DriftWindows windows) {
        ActionDispatcher dispatcher = dispatchers.get(action);
        if (dispatcher == null) {
            logger.error("No dispatcher registered for {}", action);
            return ActionResult.failure(action, "No dispatcher registered for " + action, clock.instant());
        }
        if (!ledger.claim(runId, action, clock.instant())) {
            return ActionResult.skipped(action, "Already dispatched for run " + runId, clock.instant());
        }

        logger.info("Executing action: {}", action);
        Map<String, Object> details;
        try {
            details = dispatcher.dispatch(windows);
        } catch (RuntimeException e) {
            logger.error("Action {} failed: {}", action, e.getMessage(), e);
            return ActionResult.failure(action, e.getMessage(), clock.instant());
        }

        switch (action) {
            case FINE_TUNE_MODEL:
                metrics.recordRetrain();
                break;
            case REINDEX_DOCUMENTS:
                metrics.recordReindex();
                break;
            default:
                break;
        }
        Object cost = details.get(COST_USD);
        if (cost instanceof Number) {
            metrics.addApiCost(((Number) cost).doubleValue());
        }
        return ActionResult.success(action, details, clock.instant());
    }
}
