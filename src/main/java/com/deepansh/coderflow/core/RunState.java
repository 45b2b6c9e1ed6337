package com.deepansh.coderflow.core;

import com.deepansh.coderflow.model.Message;
import com.deepansh.coderflow.model.RunStatus;
import com.deepansh.coderflow.model.ToolCall;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Holds all mutable state for a single workflow run.
 * Owned by exactly one run; never shared, so no locking.
 *
 * Read access is public. Mutators are package-private: only {@link WorkflowEngine}
 * moves the current node, counts steps and sets the terminal status.
 */
@Getter
public class RunState {

    private final String runId;
    private final List<Message> history = new ArrayList<>();
    private final List<ToolCall> pendingCalls = new ArrayList<>();

    private Node currentNode;

    /** Agent whose tool calls are pending; control returns here after a plain dispatch */
    private Node callerAgent;

    private int stepCount;
    private RunStatus status = RunStatus.RUNNING;
    private String failureReason;

    private RunState(String runId, Node currentNode) {
        this.runId = runId;
        this.currentNode = currentNode;
        this.callerAgent = currentNode;
    }

    /**
     * Fresh run: one user message, orchestrator to move first.
     */
    public static RunState start(String input) {
        RunState state = new RunState(UUID.randomUUID().toString(), Node.ORCHESTRATOR);
        state.history.add(Message.user(input));
        return state;
    }

    public List<Message> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public List<ToolCall> getPendingCalls() {
        return Collections.unmodifiableList(pendingCalls);
    }

    public boolean isTerminal() {
        return status != RunStatus.RUNNING;
    }

    /** Text of the most recent agent message that has any, or null */
    public String lastAgentText() {
        for (int i = history.size() - 1; i >= 0; i--) {
            Message m = history.get(i);
            if (m.getRole() == Message.Role.agent && m.hasText()) {
                return m.getText();
            }
        }
        return null;
    }

    void append(Message message) {
        history.add(message);
    }

    void queueCalls(Node caller, List<ToolCall> calls) {
        this.callerAgent = caller;
        pendingCalls.addAll(calls);
    }

    List<ToolCall> drainPendingCalls() {
        List<ToolCall> drained = new ArrayList<>(pendingCalls);
        pendingCalls.clear();
        return drained;
    }

    void moveTo(Node next) {
        if (next == null || next == Node.END) {
            throw new IllegalArgumentException("Cannot move a run to " + next);
        }
        this.currentNode = next;
    }

    void incrementStep() {
        stepCount++;
    }

    void finish(RunStatus terminal, String reason) {
        this.status = terminal;
        this.failureReason = reason;
    }
}
