package com.example.proctorstream.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolRegistrationConfig {

    private final MonitoringTools monitoringTools;

    public ToolRegistrationConfig(MonitoringTools monitoringTools) {
        this.monitoringTools = monitoringTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(monitoringTools)
                .build();
    }
}
