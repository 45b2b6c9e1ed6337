package com.deepansh.coderflow.tool.gateway;

import com.deepansh.coderflow.tool.AgentTool;
import com.deepansh.coderflow.tool.ToolInvocation;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A tool that lives behind the remote gateway. Calls run on the tool executor
 * so the HTTP round trip never blocks the caller's thread.
 */
@Slf4j
public class GatewayTool implements AgentTool {

    private final String name;
    private final String description;
    private final Map<String, Object> inputSchema;
    private final ToolGatewayClient client;
    private final Executor executor;

    public GatewayTool(String name, String description, Map<String, Object> inputSchema,
                       ToolGatewayClient client, Executor executor) {
        this.name = name;
        this.description = description != null ? description : "";
        this.inputSchema = inputSchema != null ? inputSchema : Map.of("type", "object", "properties", Map.of());
        this.client = client;
        this.executor = executor;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return inputSchema;
    }

    @Override
    public CompletableFuture<Object> execute(ToolInvocation invocation) {
        // Parameterless gateway tools reject unexpected arguments
        Map<String, Object> arguments = hasParameters() ? invocation.arguments() : Map.of();
        if (!hasParameters() && !invocation.arguments().isEmpty()) {
            log.debug("Tool [{}] takes no parameters, ignoring {}", name, invocation.arguments().keySet());
        }
        return CompletableFuture.supplyAsync(() -> client.callTool(name, arguments), executor);
    }

    private boolean hasParameters() {
        return inputSchema.get("properties") instanceof Map<?, ?> props && !props.isEmpty();
    }
}
