package com.example.driftmonitor.mcp;

import com.example.driftmonitor.decision.DriftDecisionEngine;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.stream.Collectors;

@Service
public class CapabilitiesTools {

    private final DriftDecisionEngine decisionEngine;

    public CapabilitiesTools(DriftDecisionEngine decisionEngine) {
        this.decisionEngine = decisionEngine;
    }

    @Tool(description = "Describe the drift monitor server and the signal-to-action rules it applies")
    public Map<String, Object> capabilities_list() {
        return Map.of(
                "server", Map.of("name", "drift-monitor", "version", "0.1.0"),
                "capabilities", Map.of(
                    "tools", true,
                    "resources", false,
                    "prompts", false,
                    "completion", false
                ),
                "rules", decisionEngine.rules().stream()
                        .map(r -> Map.of("signal", r.getSignal(), "action", r.getAction().value()))
                        .collect(Collectors.toList())
        );
    }
}
