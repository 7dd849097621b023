package com.example.vrpassistant.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolRegistrationConfig {

    private final VrpTools vrpTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(VrpTools vrpTools, CapabilitiesTools capTools) {
        this.vrpTools = vrpTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(vrpTools, capTools)
                .build();
    }
}
