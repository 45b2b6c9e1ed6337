package com.deepansh.coderflow.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Name-indexed set of tools, built once at startup and read-only afterwards.
 *
 * Spring injects every {@link AgentTool} bean, then each {@link ToolProvider}
 * contributes the tools it discovers. The first registration of a name wins;
 * later duplicates are skipped with a warning.
 *
 * The backing map is never mutated after construction, so concurrent runs can
 * look tools up without coordination.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools;

    @Autowired
    public ToolRegistry(List<AgentTool> toolBeans, ObjectProvider<ToolProvider> providers) {
        this(toolBeans, providers.orderedStream().toList());
    }

    public ToolRegistry(List<AgentTool> toolBeans, List<ToolProvider> providers) {
        Map<String, AgentTool> indexed = new LinkedHashMap<>();
        toolBeans.forEach(tool -> register(indexed, tool));
        for (ToolProvider provider : providers) {
            provider.loadTools().forEach(tool -> register(indexed, tool));
        }
        this.tools = Collections.unmodifiableMap(indexed);
        log.info("Total tools registered: {}", tools.size());
    }

    public static ToolRegistry of(AgentTool... tools) {
        return new ToolRegistry(List.of(tools), List.<ToolProvider>of());
    }

    private static void register(Map<String, AgentTool> indexed, AgentTool tool) {
        if (indexed.containsKey(tool.getName())) {
            log.warn("Duplicate tool name [{}], keeping the first registration", tool.getName());
            return;
        }
        indexed.put(tool.getName(), tool);
        log.info("Registered tool: [{}] - {}", tool.getName(), tool.getDescription());
    }

    public Optional<AgentTool> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public List<ToolDefinition> getAllDefinitions() {
        return tools.values().stream()
                .map(ToolDefinition::from)
                .collect(Collectors.toList());
    }

    public boolean hasTool(String name) {
        return name != null && tools.containsKey(name);
    }

    public Set<String> toolNames() {
        return tools.keySet();
    }

    public int toolCount() {
        return tools.size();
    }
}
