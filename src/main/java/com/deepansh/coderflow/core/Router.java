package com.deepansh.coderflow.core;

import com.deepansh.coderflow.model.ToolCall;
import com.deepansh.coderflow.model.ToolOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the next node after every agent turn and every dispatch step.
 *
 * Pure: the decision depends only on the arguments. Routing ambiguity is never
 * fatal; it is logged and resolved to a safe default.
 */
@Component
@Slf4j
public class Router {

    /**
     * After an agent turn:
     * tool calls win, then a routing directive in the text, otherwise the run ends.
     */
    public Node afterAgentTurn(Node agent, String text, List<ToolCall> calls) {
        if (calls != null && !calls.isEmpty()) {
            log.info("Route [{} -> {}]: {} tool call(s)", agent, Node.DISPATCHER, calls.size());
            return Node.DISPATCHER;
        }

        Optional<RoutingDirective> directive = RoutingDirective.findIn(text);
        if (directive.isPresent()) {
            Node target = directive.get().target();
            log.info("Route [{} -> {}]: directive '{}'", agent, target, directive.get().token());
            return target;
        }

        log.info("Route [{} -> {}]: no tool call and no directive", agent, Node.END);
        return Node.END;
    }

    /**
     * After a dispatch step:
     * the first control transfer wins, otherwise control returns to the agent that made the calls.
     * Unresolvable targets and empty dispatch steps fall back to the orchestrator.
     */
    public Node afterDispatch(Node caller, List<ToolOutcome> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) {
            log.warn("Route [{} -> {}]: dispatch step produced no outcome", Node.DISPATCHER, Node.ORCHESTRATOR);
            return Node.ORCHESTRATOR;
        }

        for (ToolOutcome outcome : outcomes) {
            if (outcome instanceof ToolOutcome.ControlTransfer transfer) {
                Optional<Node> target = Node.agentNamed(transfer.target());
                if (target.isEmpty()) {
                    log.warn("Route [{} -> {}]: control transfer names unknown agent '{}'",
                            Node.DISPATCHER, Node.ORCHESTRATOR, transfer.target());
                    return Node.ORCHESTRATOR;
                }
                log.info("Route [{} -> {}]: control transfer", Node.DISPATCHER, target.get());
                return target.get();
            }
        }

        if (caller == null || !caller.isAgent()) {
            log.warn("Route [{} -> {}]: no calling agent recorded", Node.DISPATCHER, Node.ORCHESTRATOR);
            return Node.ORCHESTRATOR;
        }
        log.info("Route [{} -> {}]: back to caller", Node.DISPATCHER, caller);
        return caller;
    }
}
