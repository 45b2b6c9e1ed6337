package com.deepansh.coderflow.tool.gateway;

import com.deepansh.coderflow.config.ToolProperties;
import com.deepansh.coderflow.exception.AgentException;
import com.deepansh.coderflow.tool.AgentTool;
import com.deepansh.coderflow.tool.ToolProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Registers the tools a remote gateway exposes, once, at startup.
 *
 * Disabled unless tools.gateway.enabled=true. When enabled, an unreachable gateway
 * fails startup rather than leaving agents with a silently reduced tool set.
 */
@Component
@Slf4j
public class GatewayToolProvider implements ToolProvider {

    private final ToolProperties toolProperties;
    private final ToolGatewayClient client;
    private final Executor executor;

    @Autowired
    public GatewayToolProvider(ToolProperties toolProperties,
                               RestClient.Builder restClientBuilder,
                               @Qualifier("toolTaskExecutor") Executor executor) {
        this.toolProperties = toolProperties;
        this.executor = executor;

        ToolProperties.Gateway gateway = toolProperties.getGateway();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(gateway.getConnectTimeoutMs());
        requestFactory.setReadTimeout(gateway.getReadTimeoutMs());

        this.client = new ToolGatewayClient(restClientBuilder.clone()
                .baseUrl(gateway.getBaseUrl())
                .requestFactory(requestFactory)
                .build());
    }

    GatewayToolProvider(ToolProperties toolProperties, ToolGatewayClient client, Executor executor) {
        this.toolProperties = toolProperties;
        this.client = client;
        this.executor = executor;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<AgentTool> loadTools() {
        if (!toolProperties.getGateway().isEnabled()) {
            log.info("Tool gateway disabled, no remote tools loaded");
            return List.of();
        }

        String baseUrl = toolProperties.getGateway().getBaseUrl();
        log.info("Loading tools from gateway {}", baseUrl);

        List<Map<String, Object>> definitions;
        try {
            definitions = client.listTools();
        } catch (AgentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AgentException("Tool gateway at " + baseUrl + " is unreachable: " + e.getMessage(), e);
        }

        List<AgentTool> tools = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Map<String, Object> def : definitions) {
            Object name = def.get("name");
            if (name == null || name.toString().isBlank()) {
                log.warn("Skipping gateway tool without a name: {}", def);
                continue;
            }
            if (!names.add(name.toString())) {
                continue;
            }
            Object schema = def.get("inputSchema") != null ? def.get("inputSchema") : def.get("input_schema");
            Object description = def.get("description");
            tools.add(new GatewayTool(
                    name.toString(),
                    description != null ? description.toString() : null,
                    schema instanceof Map<?, ?> ? (Map<String, Object>) schema : null,
                    client,
                    executor));
        }

        log.info("Loaded {} tool(s) from gateway: {}", tools.size(), names);
        return tools;
    }
}
