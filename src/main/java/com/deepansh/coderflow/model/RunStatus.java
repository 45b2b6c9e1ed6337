package com.deepansh.coderflow.model;

/**
 * Lifecycle of a single workflow run. Everything except RUNNING is terminal.
 */
public enum RunStatus {
    RUNNING,
    /** The router chose termination */
    COMPLETED,
    /** The step ceiling was reached before the router chose termination */
    STEP_LIMIT_EXCEEDED,
    /** The agent turn client raised instead of producing a message */
    COLLABORATOR_FAILED
}
