package com.deepansh.coderflow.core;

import com.deepansh.coderflow.exception.WorkflowException;
import com.deepansh.coderflow.model.RunStatus;
import com.deepansh.coderflow.model.WorkflowRequest;
import com.deepansh.coderflow.model.WorkflowResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;

/**
 * Entry point for one workflow run.
 *
 * Seeds a fresh {@link RunState}, hands it to the engine and maps whatever
 * terminal state comes back into a response. A collaborator failure is logged
 * and reported with the history gathered before the failure.
 */
@Service
@Slf4j
public class WorkflowService {

    private final WorkflowEngine engine;

    public WorkflowService(WorkflowEngine engine) {
        this.engine = engine;
    }

    public WorkflowResponse run(WorkflowRequest request) {
        RunState state = RunState.start(request.getInput());
        long start = System.currentTimeMillis();

        log.info("Workflow run started [run={}, input='{}']", state.getRunId(), request.getInput());

        try {
            engine.run(state);
        } catch (WorkflowException e) {
            log.error("Workflow run failed [run={}]: {}", state.getRunId(), e.getMessage());
        }

        log.info("Workflow run finished [run={}, status={}, steps={}, messages={}, latency={}ms]",
                state.getRunId(), state.getStatus(), state.getStepCount(),
                state.getHistory().size(), System.currentTimeMillis() - start);

        return toResponse(state);
    }

    static WorkflowResponse toResponse(RunState state) {
        String finalAnswer = state.lastAgentText();
        if (state.getStatus() == RunStatus.STEP_LIMIT_EXCEEDED && finalAnswer == null) {
            finalAnswer = "I was unable to complete the task within the allowed steps.";
        }
        return WorkflowResponse.builder()
                .runId(state.getRunId())
                .status(state.getStatus())
                .finalAnswer(finalAnswer)
                .stepCount(state.getStepCount())
                .failureReason(state.getFailureReason())
                .history(new ArrayList<>(state.getHistory()))
                .build();
    }
}
