package com.deepansh.coderflow.llm;

import com.deepansh.coderflow.model.Message;
import com.deepansh.coderflow.tool.ToolDefinition;

import java.util.List;

public interface LlmClient {

    /**
     * Send a system prompt, the full conversation and the available tool schemas to the model.
     *
     * @param systemPrompt instructions for the agent taking the turn
     * @param history      full conversation so far (user + agent + tool results)
     * @param tools        tool definitions the model can choose to invoke
     * @return one agent message; tool invocations are attached as raw payloads, untouched
     */
    Message chat(String systemPrompt, List<Message> history, List<ToolDefinition> tools);
}
