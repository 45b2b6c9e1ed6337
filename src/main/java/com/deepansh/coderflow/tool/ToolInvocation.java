package com.deepansh.coderflow.tool;

import java.util.Map;

/**
 * What a handler receives: the call's arguments plus its correlation id,
 * for handlers that need to refer back to the call that triggered them.
 */
public record ToolInvocation(String callId, Map<String, Object> arguments) {

    public ToolInvocation {
        arguments = arguments == null ? Map.of() : arguments;
    }

    public Object argument(String name) {
        return arguments.get(name);
    }

    public String stringArgument(String name) {
        Object value = arguments.get(name);
        return value == null ? null : value.toString();
    }
}
