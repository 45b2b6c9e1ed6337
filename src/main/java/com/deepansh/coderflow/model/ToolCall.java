package com.deepansh.coderflow.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical tool invocation, whatever shape the model used to express it.
 */
@Value
@Builder
public class ToolCall {

    /** Correlation token, unique within one agent turn. Echoed back on the tool result message. */
    String id;

    String toolName;

    /** Insertion-ordered; never contains the correlation key or the {@code __arg1} placeholder */
    Map<String, Object> arguments;

    public Map<String, Object> getArguments() {
        return arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
