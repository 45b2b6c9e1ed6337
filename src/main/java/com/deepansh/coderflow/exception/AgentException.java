package com.deepansh.coderflow.exception;

/**
 * Non-recoverable fault in a collaborator or in configuration:
 * bad API key, rejected request, unreachable tool gateway.
 *
 * Listed in the circuit breaker's ignore list, so client errors never open the circuit.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
