package com.deepansh.coderflow.tool;

import com.deepansh.coderflow.config.WorkflowProperties;
import com.deepansh.coderflow.model.ToolCall;
import com.deepansh.coderflow.model.ToolOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one canonical tool call against a {@link ToolRegistry}.
 *
 * Never throws. An unknown tool, a handler exception, a failed future and a
 * timeout all come back as {@link ToolOutcome.Failure}, so the calling agent
 * sees the problem as a tool result and can correct itself.
 */
@Component
@Slf4j
public class ToolDispatcher {

    private final WorkflowProperties properties;
    private final ObjectMapper objectMapper;

    public ToolDispatcher(WorkflowProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public ToolOutcome dispatch(ToolCall call, ToolRegistry registry) {
        AgentTool tool = registry.find(call.getToolName()).orElse(null);
        if (tool == null) {
            log.warn("Unknown tool [{}]. Available tools: {}", call.getToolName(), registry.toolNames());
            return ToolOutcome.failure("tool not found: " + call.getToolName());
        }

        log.info("Executing tool: [{}] with args: {} [callId={}]", call.getToolName(), call.getArguments(), call.getId());
        long start = System.currentTimeMillis();

        Duration timeout = properties.getToolTimeout();
        CompletableFuture<Object> future = null;
        try {
            future = tool.execute(new ToolInvocation(call.getId(), call.getArguments()));
            if (future == null) {
                return ToolOutcome.failure("tool " + call.getToolName() + " returned no result");
            }
            Object result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            ToolOutcome outcome = toOutcome(result);
            log.debug("Tool [{}] returned in {}ms: {}", call.getToolName(), System.currentTimeMillis() - start, outcome);
            return outcome;

        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Tool [{}] timed out after {}ms", call.getToolName(), timeout.toMillis());
            return ToolOutcome.failure("tool " + call.getToolName() + " timed out after " + timeout.toMillis() + "ms");

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for tool [{}]", call.getToolName());
            return ToolOutcome.failure("tool " + call.getToolName() + " was interrupted");

        } catch (ExecutionException e) {
            log.error("Tool [{}] failed", call.getToolName(), e.getCause());
            return ToolOutcome.failure("tool " + call.getToolName() + " failed: " + describe(e));

        } catch (Exception e) {
            // Handler threw before handing back a future
            log.error("Tool [{}] failed", call.getToolName(), e);
            return ToolOutcome.failure("tool " + call.getToolName() + " failed: " + describe(e));
        }
    }

    /**
     * Handoff values and {@code {target, note}} maps become control transfers;
     * everything else is stringified.
     */
    ToolOutcome toOutcome(Object result) {
        if (result instanceof Handoff handoff) {
            return ToolOutcome.transfer(handoff.target(), handoff.note());
        }
        if (result instanceof Map<?, ?> map && map.containsKey("target")) {
            Object target = map.get("target");
            Object note = map.get("note");
            return ToolOutcome.transfer(
                    target == null ? null : target.toString(),
                    note == null ? null : note.toString());
        }
        if (result == null) {
            return ToolOutcome.value("");
        }
        if (result instanceof CharSequence text) {
            return ToolOutcome.value(text.toString());
        }
        try {
            return ToolOutcome.value(objectMapper.writeValueAsString(result));
        } catch (JsonProcessingException e) {
            log.debug("Result of type {} is not JSON-serializable, using toString()", result.getClass().getName());
            return ToolOutcome.value(String.valueOf(result));
        }
    }

    /** Innermost cause's message, or its class name when it has none */
    private static String describe(Throwable error) {
        Throwable cursor = error;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
