package com.deepansh.coderflow.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Text markers an agent can put in a plain-text turn to hand control to another agent.
 *
 * Substring match on the lower-cased text, checked in declaration order. The same
 * tokens double as routing tool names, so prompts only have to teach one vocabulary.
 */
public enum RoutingDirective {

    TO_PLANNER("route_to_planner", Node.PLANNER),
    TO_CODER("route_to_coder", Node.CODER),
    TO_ORCHESTRATOR("route_to_orchestrator", Node.ORCHESTRATOR);

    private final String token;
    private final Node target;

    RoutingDirective(String token, Node target) {
        this.token = token;
        this.target = target;
    }

    public String token() {
        return token;
    }

    public Node target() {
        return target;
    }

    public static Optional<RoutingDirective> findIn(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (RoutingDirective directive : values()) {
            if (lower.contains(directive.token)) {
                return Optional.of(directive);
            }
        }
        return Optional.empty();
    }

    public static RoutingDirective forTarget(Node target) {
        for (RoutingDirective directive : values()) {
            if (directive.target == target) {
                return directive;
            }
        }
        throw new IllegalArgumentException("No routing directive for node " + target);
    }
}
