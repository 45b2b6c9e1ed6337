package com.deepansh.coderflow.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowResponse {

    private String runId;

    private RunStatus status;

    /** Text of the last agent message, if any */
    private String finalAnswer;

    private int stepCount;

    /** Set when status is STEP_LIMIT_EXCEEDED or COLLABORATOR_FAILED */
    private String failureReason;

    @Builder.Default
    private List<Message> history = new ArrayList<>();
}
