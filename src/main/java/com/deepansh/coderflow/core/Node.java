package com.deepansh.coderflow.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Nodes of the workflow graph: the three agents, the tool dispatcher, and termination.
 */
public enum Node {

    ORCHESTRATOR("orchestrator", true),
    PLANNER("planner", true),
    CODER("coder", true),
    DISPATCHER("tools", false),
    END("end", false);

    private final String wireName;
    private final boolean agent;

    Node(String wireName, boolean agent) {
        this.wireName = wireName;
        this.agent = agent;
    }

    /** Name used in messages, routing tools and directive tokens */
    public String wireName() {
        return wireName;
    }

    public boolean isAgent() {
        return agent;
    }

    /**
     * Resolves an agent by wire name, ignoring case and surrounding whitespace.
     * Empty for unknown names and for the non-agent nodes.
     */
    public static Optional<Node> agentNamed(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(Node::isAgent)
                .filter(n -> n.wireName.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
