package com.deepansh.coderflow.resilience;

import com.deepansh.coderflow.llm.LlmClient;
import com.deepansh.coderflow.model.Message;
import com.deepansh.coderflow.tool.ToolDefinition;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the active model client that adds retry + circuit breaker.
 *
 * Retry config (in application.yml):
 * - 3 attempts, exponential backoff from 2s
 * - Retries network errors, 429 and 5xx; AgentException is ignored
 *
 * Circuit breaker config:
 * - Opens after 50% failure rate in a sliding window of 10 calls
 * - Waits 30s before allowing probe calls (half-open state)
 *
 * No fallback: once retries are exhausted or the circuit is open the exception
 * reaches the workflow engine, which ends the run as COLLABORATOR_FAILED.
 */
@Component
@Primary
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "llmClient")
    @CircuitBreaker(name = "llmClient")
    public Message chat(String systemPrompt, List<Message> history, List<ToolDefinition> tools) {
        return delegate.chat(systemPrompt, history, tools);
    }
}
