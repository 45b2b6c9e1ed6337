package com.deepansh.coderflow.tool;

/**
 * Handler result that asks the workflow to hand control to another agent
 * instead of returning to the caller.
 *
 * @param target agent wire name, e.g. {@code "planner"}
 * @param note   text recorded as the tool result message
 */
public record Handoff(String target, String note) {
}
