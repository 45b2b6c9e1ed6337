package com.deepansh.coderflow.llm;

import com.deepansh.coderflow.core.AgentTurnClient;
import com.deepansh.coderflow.core.Node;
import com.deepansh.coderflow.model.Message;
import com.deepansh.coderflow.tool.ToolDefinition;
import com.deepansh.coderflow.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Produces agent turns by asking the model with the agent's system prompt
 * and every registered tool.
 */
@Component
@Slf4j
public class LlmAgentTurnClient implements AgentTurnClient {

    private final LlmClient llmClient;
    private final ToolRegistry toolRegistry;

    public LlmAgentTurnClient(LlmClient llmClient, ToolRegistry toolRegistry) {
        this.llmClient = llmClient;
        this.toolRegistry = toolRegistry;
    }

    @Override
    public Message takeTurn(Node agent, List<Message> history) {
        List<ToolDefinition> tools = toolRegistry.getAllDefinitions();
        log.debug("Agent turn [agent={}, messages={}, tools={}]", agent, history.size(), tools.size());

        Message reply = llmClient.chat(AgentPrompts.forAgent(agent), history, tools);
        if (reply == null) {
            return null;
        }
        return reply.toBuilder()
                .role(Message.Role.agent)
                .author(agent.wireName())
                .build();
    }
}
