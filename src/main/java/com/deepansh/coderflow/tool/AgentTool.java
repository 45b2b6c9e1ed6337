package com.deepansh.coderflow.tool;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Contract every tool must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the model so it knows how to invoke the tool.
 *
 * Handlers are asynchronous. A handler may fail by throwing or by completing the
 * future exceptionally; the dispatcher turns both into a failure observation, so a
 * misbehaving tool never ends the run.
 */
public interface AgentTool {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /** Primary signal the model uses to decide when to call this tool */
    String getDescription();

    /** JSON Schema (as a Map) describing the tool's input parameters */
    Map<String, Object> getInputSchema();

    /**
     * Run the tool. The future's value is the observation: a String, any
     * JSON-serializable value, or a {@link Handoff} to request a control transfer.
     */
    CompletableFuture<Object> execute(ToolInvocation invocation);
}
