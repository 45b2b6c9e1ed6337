package com.deepansh.coderflow.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One turn in the conversation. Immutable once appended to a run's history.
 */
@Value
@Builder(toBuilder = true)
public class Message {

    public enum Role {
        user, agent, tool
    }

    Role role;

    /** Agent wire name when role = agent; tool name when role = tool */
    String author;

    String text;

    /** Present when role = tool: links back to the originating tool call id */
    String toolCallId;

    /** Tool-call payloads exactly as received from the model binding. Only set when role = agent. */
    @Singular
    List<RawToolPayload> rawToolCalls;

    /**
     * Canonical calls extracted from {@link #rawToolCalls}, attached before the message
     * is appended. The model client echoes them back so tool results can be correlated.
     */
    @Singular
    List<ToolCall> toolCalls;

    public static Message user(String text) {
        return Message.builder()
                .role(Role.user)
                .text(text)
                .build();
    }

    public static Message toolResult(ToolCall call, ToolOutcome outcome) {
        return Message.builder()
                .role(Role.tool)
                .author(call.getToolName())
                .toolCallId(call.getId())
                .text(outcome.text())
                .build();
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
