package com.deepansh.coderflow.tool;

import com.deepansh.coderflow.config.WorkflowProperties;
import com.deepansh.coderflow.model.ToolCall;
import com.deepansh.coderflow.model.ToolOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class ToolDispatcherTest {

    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        WorkflowProperties properties = new WorkflowProperties();
        properties.setToolTimeout(Duration.ofMillis(200));
        dispatcher = new ToolDispatcher(properties, new ObjectMapper());
    }

    private static AgentTool tool(String name, Function<ToolInvocation, CompletableFuture<Object>> body) {
        return new AgentTool() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public String getDescription() {
                return "test tool " + name;
            }

            @Override
            public Map<String, Object> getInputSchema() {
                return Map.of("type", "object", "properties", Map.of());
            }

            @Override
            public CompletableFuture<Object> execute(ToolInvocation invocation) {
                return body.apply(invocation);
            }
        };
    }

    private static ToolCall call(String name, Map<String, Object> args) {
        return ToolCall.builder().id("call-1").toolName(name).arguments(args).build();
    }

    @Test
    void unknownTool_isFailure() {
        ToolOutcome outcome = dispatcher.dispatch(call("nope", Map.of()), ToolRegistry.of());

        assertThat(outcome).isEqualTo(ToolOutcome.failure("tool not found: nope"));
        assertThat(outcome.text()).isEqualTo("Error: tool not found: nope");
    }

    @Test
    void stringResult_isValue_andHandlerSeesArguments() {
        AgentTool echo = tool("echo", inv -> CompletableFuture.completedFuture("echo: " + inv.stringArgument("msg")));

        ToolOutcome outcome = dispatcher.dispatch(call("echo", Map.of("msg", "hi")), ToolRegistry.of(echo));

        assertThat(outcome).isEqualTo(ToolOutcome.value("echo: hi"));
    }

    @Test
    void structuredResult_isSerializedAsJson() {
        AgentTool lister = tool("lister", inv -> CompletableFuture.completedFuture(List.of("a", "b")));

        ToolOutcome outcome = dispatcher.dispatch(call("lister", Map.of()), ToolRegistry.of(lister));

        assertThat(outcome.text()).isEqualTo("[\"a\",\"b\"]");
    }

    @Test
    void nullResult_isEmptyValue() {
        AgentTool silent = tool("silent", inv -> CompletableFuture.completedFuture(null));

        assertThat(dispatcher.dispatch(call("silent", Map.of()), ToolRegistry.of(silent)))
                .isEqualTo(ToolOutcome.value(""));
    }

    @Test
    void handlerThrowingSynchronously_isFailureWithCause() {
        AgentTool broken = tool("broken", inv -> {
            throw new IllegalStateException("disk on fire");
        });

        ToolOutcome outcome = dispatcher.dispatch(call("broken", Map.of()), ToolRegistry.of(broken));

        assertThat(outcome).isInstanceOf(ToolOutcome.Failure.class);
        assertThat(outcome.text()).startsWith("Error: tool broken failed").contains("disk on fire");
    }

    @Test
    void failedFuture_isFailureWithCause() {
        AgentTool broken = tool("broken", inv -> CompletableFuture.failedFuture(new RuntimeException("bad input")));

        ToolOutcome outcome = dispatcher.dispatch(call("broken", Map.of()), ToolRegistry.of(broken));

        assertThat(outcome.text()).isEqualTo("Error: tool broken failed: bad input");
    }

    @Test
    void handlerNeverCompleting_timesOut() {
        CompletableFuture<Object> never = new CompletableFuture<>();
        AgentTool slow = tool("slow", inv -> never);

        ToolOutcome outcome = dispatcher.dispatch(call("slow", Map.of()), ToolRegistry.of(slow));

        assertThat(outcome.text()).contains("timed out after 200ms");
        assertThat(never).isCancelled();
    }

    @Test
    void handoff_isControlTransfer() {
        AgentTool route = tool("route", inv -> CompletableFuture.completedFuture(new Handoff("coder", "go code")));

        assertThat(dispatcher.dispatch(call("route", Map.of()), ToolRegistry.of(route)))
                .isEqualTo(ToolOutcome.transfer("coder", "go code"));
    }

    @Test
    void targetMap_isControlTransfer() {
        assertThat(dispatcher.toOutcome(Map.of("target", "planner")))
                .isEqualTo(ToolOutcome.transfer("planner", null));
        assertThat(dispatcher.toOutcome(Map.of("other", "planner")))
                .isInstanceOf(ToolOutcome.Value.class);
    }

    @Test
    void targetMapWithoutTarget_notesFallbackToOrchestrator() {
        Map<String, Object> result = new HashMap<>();
        result.put("target", null);

        ToolOutcome outcome = dispatcher.toOutcome(result);

        assertThat(outcome).isEqualTo(ToolOutcome.transfer(null, null));
        assertThat(outcome.text()).isEqualTo("No routing target given, returning to orchestrator");
    }
}
