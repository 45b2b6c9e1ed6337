package com.deepansh.coderflow.llm;

import com.deepansh.coderflow.exception.AgentException;
import com.deepansh.coderflow.model.Message;
import com.deepansh.coderflow.model.RawToolPayload;
import com.deepansh.coderflow.model.ToolCall;
import com.deepansh.coderflow.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenAI-compatible LLM client for Groq, OpenAI, and Gemini.
 *
 * Replies are not interpreted here: {@code tool_calls} are attached as a
 * {@link RawToolPayload.MetadataCalls} payload and list-valued {@code content}
 * as {@link RawToolPayload.ContentBlocks}, for the call extractor to normalize.
 *
 * Error handling strategy:
 *
 * | Error                  | Action                                        |
 * |------------------------|-----------------------------------------------|
 * | 401 invalid_api_key    | AgentException (not retried, not CB failure)  |
 * | 400 tool_use_failed    | Recover from failed_generation XML, continue  |
 * | 400 other              | AgentException (not retried, not CB failure)  |
 * | 429 rate limit         | RuntimeException (retried)                    |
 * | 5xx server error       | RuntimeException (retried, counts as failure) |
 * | network error          | ResourceAccessException (retried)             |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    // Groq sometimes emits tool calls as XML and rejects its own output:
    //   <function=write_file({"path": "a.py"})</function>
    //   <function=write_file{"path": "a.py"}></function>
    private static final Pattern GROQ_XML_TOOL_PATTERN =
            Pattern.compile("<function=(\\w+)\\(?(\\{.+?\\})\\)?(?:</function>|>)", Pattern.DOTALL);

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            ObjectMapper objectMapper,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public Message chat(String systemPrompt, List<Message> history, List<ToolDefinition> tools) {
        Map<String, Object> requestBody = buildRequestBody(systemPrompt, history, tools);

        log.debug("Sending {} messages to {} [model={}]",
                history.size(), providerName, props.getModel());

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                        // 5xx is retryable: RuntimeException, not AgentException
                        throw new RuntimeException(
                                providerName + " server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});

            return parseResponse(response);

        } catch (GroqToolUseFailedException e) {
            return recoverFromGroqToolUseFailure(e.getErrorBody());
        }
    }

    /**
     * Maps 4xx codes to exception types so retry and circuit breaker behave correctly.
     */
    private void handle4xxError(String body, int statusCode) {
        if (body.contains("model_decommissioned")) {
            throw new AgentException(
                    "Model '" + props.getModel() + "' is decommissioned. Update the model for provider " + providerName);
        }
        if (body.contains("tool_use_failed")) {
            throw new GroqToolUseFailedException(body);
        }
        if (statusCode == 401) {
            throw new AgentException(
                    providerName + " API key is invalid. Check your " +
                    providerName.toUpperCase() + "_API_KEY environment variable.");
        }
        if (statusCode == 429) {
            throw new RuntimeException(providerName + " rate limit exceeded. Will retry.");
        }
        throw new AgentException(providerName + " client error [" + statusCode + "]: " + body);
    }

    /**
     * Groq's tool_use_failed error carries the broken generation in "failed_generation".
     * The XML call is lifted into a direct-call payload so the turn still dispatches.
     */
    @SuppressWarnings("unchecked")
    private Message recoverFromGroqToolUseFailure(String errorBody) {
        try {
            Map<String, Object> errorMap = objectMapper.readValue(errorBody, new TypeReference<>() {});
            Map<String, Object> error = (Map<String, Object>) errorMap.get("error");
            String failedGeneration = error != null ? (String) error.get("failed_generation") : null;

            if (failedGeneration == null || failedGeneration.isBlank()) {
                log.warn("Groq tool_use_failed with no failed_generation, cannot recover");
                return plainText("I encountered a tool formatting issue. Please rephrase your request.");
            }

            Matcher matcher = GROQ_XML_TOOL_PATTERN.matcher(failedGeneration);
            if (!matcher.find()) {
                log.warn("Could not parse XML tool call from failed_generation: {}", failedGeneration);
                return plainText("I encountered a tool formatting issue. Please rephrase your request.");
            }

            Map<String, Object> recovered = new LinkedHashMap<>();
            recovered.put("id", "groq-recovered-" + UUID.randomUUID().toString().substring(0, 8));
            recovered.put("name", matcher.group(1));
            recovered.put("args", matcher.group(2));
            log.info("Recovered Groq tool call: tool={}", matcher.group(1));

            return Message.builder()
                    .role(Message.Role.agent)
                    .rawToolCall(new RawToolPayload.DirectCalls(List.of(recovered)))
                    .build();

        } catch (JsonProcessingException | ClassCastException e) {
            log.error("Failed to recover from Groq tool_use_failed: {}", e.getMessage());
            return plainText("I encountered a tool formatting issue. Please rephrase your request.");
        }
    }

    private Message plainText(String text) {
        return Message.builder().role(Message.Role.agent).text(text).build();
    }

    private Map<String, Object> buildRequestBody(String systemPrompt, List<Message> history, List<ToolDefinition> tools) {
        List<Map<String, Object>> formattedMessages = new ArrayList<>();
        formattedMessages.add(Map.of("role", "system", "content", systemPrompt));
        history.stream().map(this::formatMessage).forEach(formattedMessages::add);

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", formattedMessages);

        if (!tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        switch (msg.getRole()) {
            case tool -> {
                m.put("role", "tool");
                m.put("tool_call_id", msg.getToolCallId());
                m.put("content", msg.getText() != null ? msg.getText() : "");
            }
            case agent -> {
                // Each agent speaks as "assistant"; the name keeps the crew members apart.
                m.put("role", "assistant");
                m.put("name", msg.getAuthor());
                m.put("content", msg.getText());
                if (!msg.getToolCalls().isEmpty()) {
                    m.put("tool_calls", msg.getToolCalls().stream().map(this::formatToolCall).toList());
                }
            }
            default -> {
                m.put("role", "user");
                m.put("content", msg.getText() != null ? msg.getText() : "");
            }
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCall tc) {
        Map<String, Object> fn = new HashMap<>();
        fn.put("name", tc.getToolName());
        try {
            fn.put("arguments", objectMapper.writeValueAsString(tc.getArguments()));
        } catch (JsonProcessingException e) {
            fn.put("arguments", "{}");
        }
        Map<String, Object> tcMap = new HashMap<>();
        tcMap.put("id", tc.getId());
        tcMap.put("type", "function");
        tcMap.put("function", fn);
        return tcMap;
    }

    @SuppressWarnings("unchecked")
    private Message parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = response != null
                ? (List<Map<String, Object>>) response.get("choices")
                : null;
        if (choices == null || choices.isEmpty()) {
            throw new AgentException(providerName + " returned no choices in response");
        }

        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            log.debug("Token usage: prompt={} completion={}",
                    usage.getOrDefault("prompt_tokens", 0), usage.getOrDefault("completion_tokens", 0));
        }

        Map<String, Object> choice = choices.get(0);
        Map<String, Object> message = (Map<String, Object>) choice.get("message");
        if (message == null) {
            throw new AgentException(providerName + " returned a choice without a message");
        }
        log.debug("{} finish_reason: {}", providerName, choice.get("finish_reason"));

        Message.MessageBuilder builder = Message.builder().role(Message.Role.agent);

        Object content = message.get("content");
        if (content instanceof List<?> blocks) {
            builder.rawToolCall(new RawToolPayload.ContentBlocks((List<Object>) blocks));
        } else if (content != null) {
            builder.text(content.toString());
        }

        Object toolCalls = message.get("tool_calls");
        if (toolCalls instanceof List<?> list && !list.isEmpty()) {
            builder.rawToolCall(new RawToolPayload.MetadataCalls(Map.of("tool_calls", list)));
        }
        return builder.build();
    }

    private static class GroqToolUseFailedException extends RuntimeException {
        private final String errorBody;

        GroqToolUseFailedException(String errorBody) {
            super("Groq tool_use_failed");
            this.errorBody = errorBody;
        }

        String getErrorBody() {
            return errorBody;
        }
    }
}
