package com.deepansh.coderflow.tool.impl;

import com.deepansh.coderflow.core.Node;
import com.deepansh.coderflow.core.RoutingDirective;
import com.deepansh.coderflow.tool.AgentTool;
import com.deepansh.coderflow.tool.Handoff;
import com.deepansh.coderflow.tool.ToolInvocation;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Hands control to another agent. The tool name is the routing directive token,
 * so {@code route_to_planner} works both as a tool call and as plain text.
 */
public class RouteToAgentTool implements AgentTool {

    private final Node target;

    public RouteToAgentTool(Node target) {
        if (target == null || !target.isAgent()) {
            throw new IllegalArgumentException("Routing target must be an agent, got " + target);
        }
        this.target = target;
    }

    @Override
    public String getName() {
        return RoutingDirective.forTarget(target).token();
    }

    @Override
    public String getDescription() {
        return "Route the workflow to the " + target.wireName() + " agent.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of()
        );
    }

    @Override
    public CompletableFuture<Object> execute(ToolInvocation invocation) {
        return CompletableFuture.completedFuture(
                new Handoff(target.wireName(), "Routing to " + target.wireName()));
    }
}
