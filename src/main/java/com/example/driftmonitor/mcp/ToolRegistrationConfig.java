package com.example.driftmonitor.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final DriftTools driftTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(DriftTools driftTools, CapabilitiesTools capTools) {
        this.driftTools = driftTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(driftTools, capTools)
                .build();
    }
}
