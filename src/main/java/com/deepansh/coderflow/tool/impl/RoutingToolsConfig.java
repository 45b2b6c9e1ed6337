package com.deepansh.coderflow.tool.impl;

import com.deepansh.coderflow.core.Node;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RoutingToolsConfig {

    @Bean
    public RouteToAgentTool routeToPlanner() {
        return new RouteToAgentTool(Node.PLANNER);
    }

    @Bean
    public RouteToAgentTool routeToCoder() {
        return new RouteToAgentTool(Node.CODER);
    }

    @Bean
    public RouteToAgentTool routeToOrchestrator() {
        return new RouteToAgentTool(Node.ORCHESTRATOR);
    }
}
