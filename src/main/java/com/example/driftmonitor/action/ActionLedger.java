package com.example.driftmonitor.action;

import com.example.driftmonitor.decision.DriftAction;
import com.example.driftmonitor.kv.KvClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Records which actions a run has already claimed, so a re-submitted run id never
 * dispatches the same action twice.
 */
public class ActionLedger {

    private static final Logger logger = LoggerFactory.getLogger(ActionLedger.class);

    static final String KEY_PREFIX = "drift:action:";

    private final KvClient kvClient;
    private final Duration ttl;

    public ActionLedger(KvClient kvClient, Duration ttl) {
        this.kvClient = kvClient;
        this.ttl = ttl;
    }

    static String key(String runId, DriftAction action) {
        return KEY_PREFIX + runId + ":" + action.value();
    }

    /**
     * @return false when the action was already claimed for this run. An unreachable
     *         ledger does not block dispatch.
     */
    public boolean claim(String runId, DriftAction action, Instant at) {
        String key = key(runId, action);
        try {
            boolean claimed = kvClient.setIfAbsent(key, at.toString(), ttl);
            if (!claimed) {
                logger.info("Action {} already claimed for run {}", action, runId);
            }
            return claimed;
        } catch (RuntimeException e) {
            logger.warn("Action ledger unavailable, dispatching {} for run {} unclaimed: {}",
                    action, runId, e.getMessage());
            return true;
        }
    }
}
