package com.deepansh.coderflow.core;

import com.deepansh.coderflow.model.Message;

import java.util.List;

/**
 * Model-binding collaborator: produces one agent turn.
 */
public interface AgentTurnClient {

    /**
     * @param agent   the agent taking the turn
     * @param history full ordered conversation so far
     * @return one new message; tool invocations, if any, as raw payloads in whatever
     *         shape the model produced
     */
    Message takeTurn(Node agent, List<Message> history);
}
