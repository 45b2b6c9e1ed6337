package com.deepansh.coderflow.model;

/**
 * Result of dispatching one {@link ToolCall}. Exactly one variant per dispatch.
 */
public sealed interface ToolOutcome
        permits ToolOutcome.Value, ToolOutcome.Failure, ToolOutcome.ControlTransfer {

    /** Content of the tool message appended to history for this outcome */
    String text();

    static ToolOutcome value(String text) {
        return new Value(text);
    }

    static ToolOutcome failure(String message) {
        return new Failure(message);
    }

    static ToolOutcome transfer(String target, String note) {
        return new ControlTransfer(target, note);
    }

    record Value(String result) implements ToolOutcome {
        public Value {
            result = result == null ? "" : result;
        }

        @Override
        public String text() {
            return result;
        }
    }

    record Failure(String message) implements ToolOutcome {
        @Override
        public String text() {
            return "Error: " + message;
        }
    }

    /**
     * Handler asked for an explicit hand-off. {@code target} is kept as received;
     * the router decides whether it names a known agent, and falls back to the
     * orchestrator when it does not.
     */
    record ControlTransfer(String target, String note) implements ToolOutcome {
        @Override
        public String text() {
            if (note != null && !note.isBlank()) {
                return note;
            }
            if (target == null || target.isBlank()) {
                return "No routing target given, returning to orchestrator";
            }
            return "Routing to " + target;
        }
    }
}
