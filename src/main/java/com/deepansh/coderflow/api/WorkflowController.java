package com.deepansh.coderflow.api;

import com.deepansh.coderflow.core.WorkflowService;
import com.deepansh.coderflow.model.WorkflowRequest;
import com.deepansh.coderflow.model.WorkflowResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * POST /api/v1/workflow/run
 *   Body: {"input": "..."}, runs the orchestrator/planner/coder workflow to a terminal state.
 *
 * GET /api/v1/workflow/health
 */
@RestController
@RequestMapping("/api/v1/workflow")
@RequiredArgsConstructor
@Slf4j
public class WorkflowController {

    private final WorkflowService workflowService;

    @PostMapping("/run")
    public ResponseEntity<WorkflowResponse> run(@Valid @RequestBody WorkflowRequest request) {
        log.info("Workflow run request [inputLength={}]", request.getInput().length());
        return ResponseEntity.ok(workflowService.run(request));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
