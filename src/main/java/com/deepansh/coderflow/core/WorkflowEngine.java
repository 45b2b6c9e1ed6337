package com.deepansh.coderflow.core;

import com.deepansh.coderflow.config.WorkflowProperties;
import com.deepansh.coderflow.exception.WorkflowException;
import com.deepansh.coderflow.model.Message;
import com.deepansh.coderflow.model.RunStatus;
import com.deepansh.coderflow.model.ToolCall;
import com.deepansh.coderflow.model.ToolOutcome;
import com.deepansh.coderflow.tool.ToolDispatcher;
import com.deepansh.coderflow.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives a run: execute the current node, append what it produced, route, repeat.
 *
 * Per step:
 * 1. Agent node → one turn from the {@link AgentTurnClient}, tool calls extracted and queued
 * 2. Dispatcher node → pending calls drained and dispatched, one tool message per call
 * 3. {@link Router} picks the next node; END finishes the run
 * 4. Step counter checked against the ceiling
 *
 * Steps run strictly in sequence; nothing observes a later step's effects.
 */
@Service
@Slf4j
public class WorkflowEngine {

    private final AgentTurnClient agentTurnClient;
    private final CallExtractor callExtractor;
    private final Router router;
    private final ToolDispatcher toolDispatcher;
    private final ToolRegistry toolRegistry;
    private final WorkflowProperties properties;

    public WorkflowEngine(AgentTurnClient agentTurnClient,
                          CallExtractor callExtractor,
                          Router router,
                          ToolDispatcher toolDispatcher,
                          ToolRegistry toolRegistry,
                          WorkflowProperties properties) {
        this.agentTurnClient = agentTurnClient;
        this.callExtractor = callExtractor;
        this.router = router;
        this.toolDispatcher = toolDispatcher;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
    }

    /**
     * Runs until the router chooses termination or the step ceiling is reached.
     *
     * @return the same state, with status COMPLETED or STEP_LIMIT_EXCEEDED
     * @throws WorkflowException if the agent turn client fails; the carried state is COLLABORATOR_FAILED
     */
    public RunState run(RunState state) {
        int maxSteps = properties.getMaxSteps();

        while (true) {
            Node node = state.getCurrentNode();
            log.info("Step {}/{} [run={}, node={}]", state.getStepCount() + 1, maxSteps, state.getRunId(), node);

            Node next = node == Node.DISPATCHER
                    ? dispatchStep(state)
                    : agentStep(state, node);

            if (next == Node.END) {
                state.finish(RunStatus.COMPLETED, null);
                log.info("Run completed [run={}, steps={}, messages={}]",
                        state.getRunId(), state.getStepCount(), state.getHistory().size());
                return state;
            }

            state.moveTo(next);
            state.incrementStep();

            if (state.getStepCount() >= maxSteps) {
                String reason = "Step limit of " + maxSteps + " reached before the workflow terminated";
                state.finish(RunStatus.STEP_LIMIT_EXCEEDED, reason);
                log.warn("Run hit step limit ({}) [run={}, next={}]", maxSteps, state.getRunId(), next);
                return state;
            }
        }
    }

    private Node agentStep(RunState state, Node agent) {
        Message reply;
        try {
            reply = agentTurnClient.takeTurn(agent, state.getHistory());
        } catch (RuntimeException e) {
            throw collaboratorFailure(state, agent, e.getMessage(), e);
        }
        if (reply == null) {
            throw collaboratorFailure(state, agent, "agent turn returned no message", null);
        }

        List<ToolCall> calls = callExtractor.extract(reply);
        Message turn = reply.toBuilder()
                .role(Message.Role.agent)
                .author(agent.wireName())
                .clearToolCalls()
                .toolCalls(calls)
                .build();
        state.append(turn);

        Node next = router.afterAgentTurn(agent, callExtractor.textOf(turn), calls);
        if (next == Node.DISPATCHER) {
            state.queueCalls(agent, calls);
        }
        return next;
    }

    private Node dispatchStep(RunState state) {
        Node caller = state.getCallerAgent();
        List<ToolCall> calls = state.drainPendingCalls();
        List<ToolOutcome> outcomes = new ArrayList<>();
        ToolOutcome.ControlTransfer transfer = null;

        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            ToolOutcome outcome;

            if (i > 0 && !properties.isDispatchAllCalls()) {
                log.warn("Not dispatching tool call [{}] ({} of {}): only the first call of a turn is executed",
                        call.getToolName(), i + 1, calls.size());
                outcome = ToolOutcome.failure("not dispatched: only the first tool call of a turn is executed");
            } else if (transfer != null) {
                log.warn("Skipping tool call [{}]: control already transferred to '{}'",
                        call.getToolName(), transfer.target());
                outcome = ToolOutcome.failure("not dispatched: control already transferred to " + transfer.target());
            } else {
                outcome = toolDispatcher.dispatch(call, toolRegistry);
                outcomes.add(outcome);
                if (outcome instanceof ToolOutcome.ControlTransfer ct) {
                    transfer = ct;
                }
            }
            state.append(Message.toolResult(call, outcome));
        }

        return router.afterDispatch(caller, outcomes);
    }

    private WorkflowException collaboratorFailure(RunState state, Node agent, String detail, Throwable cause) {
        String reason = "Agent turn failed for " + agent + ": " + detail;
        state.finish(RunStatus.COLLABORATOR_FAILED, reason);
        log.error("Run aborted [run={}, step={}]: {}", state.getRunId(), state.getStepCount(), reason, cause);
        return new WorkflowException(reason, state, cause);
    }
}
