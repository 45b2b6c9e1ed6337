package com.deepansh.coderflow.tool.gateway;

import com.deepansh.coderflow.exception.AgentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for a remote tool gateway.
 *
 * GET  /tools       → [{name, description, inputSchema}] (or {"tools": [...]})
 * POST /tools/call  ← {name, arguments}  → {result} or {error}
 *
 * Any transport error, non-2xx status or {@code error} field surfaces as
 * {@link AgentException}; the dispatcher turns that into a tool failure.
 */
@Slf4j
public class ToolGatewayClient {

    private final RestClient restClient;

    public ToolGatewayClient(RestClient restClient) {
        this.restClient = restClient;
    }

    public List<Map<String, Object>> listTools() {
        Object body = restClient.get()
                .uri("/tools")
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw new AgentException("Tool gateway listing failed [" + res.getStatusCode() + "]: "
                            + new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8));
                })
                .body(Object.class);

        if (body instanceof List<?> list) {
            return definitions(list);
        }
        if (body instanceof Map<?, ?> map && map.get("tools") instanceof List<?> list) {
            return definitions(list);
        }
        log.warn("Tool gateway returned an unexpected tool listing: {}", body);
        return List.of();
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> definitions(List<?> entries) {
        List<Map<String, Object>> definitions = new ArrayList<>();
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> map) {
                definitions.add((Map<String, Object>) map);
            } else {
                log.warn("Skipping malformed gateway tool entry: {}", entry);
            }
        }
        return definitions;
    }

    public Object callTool(String name, Map<String, Object> arguments) {
        Map<String, Object> request = new HashMap<>();
        request.put("name", name);
        request.put("arguments", arguments);

        Map<String, Object> response = restClient.post()
                .uri("/tools/call")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw new AgentException("Tool gateway call [" + name + "] failed [" + res.getStatusCode() + "]: "
                            + new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8));
                })
                .body(new ParameterizedTypeReference<>() {});

        if (response == null) {
            return "";
        }
        Object error = response.get("error");
        if (error != null && !error.toString().isBlank()) {
            throw new AgentException(error.toString());
        }
        return response.get("result");
    }
}
