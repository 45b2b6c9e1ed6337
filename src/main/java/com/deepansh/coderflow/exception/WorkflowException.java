package com.deepansh.coderflow.exception;

import com.deepansh.coderflow.core.RunState;

/**
 * Thrown out of a run when the agent turn client fails instead of producing a message.
 * Carries the run's state, already marked COLLABORATOR_FAILED, so callers can still
 * inspect the history gathered so far.
 */
public class WorkflowException extends AgentException {

    private final transient RunState state;

    public WorkflowException(String message, RunState state, Throwable cause) {
        super(message, cause);
        this.state = state;
    }

    public RunState getState() {
        return state;
    }
}
