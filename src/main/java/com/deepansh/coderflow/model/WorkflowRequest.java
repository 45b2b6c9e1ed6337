package com.deepansh.coderflow.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class WorkflowRequest {

    /** The task handed to the orchestrator as the first user message */
    @NotBlank(message = "input must not be blank")
    private String input;
}
