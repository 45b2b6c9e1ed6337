package com.deepansh.coderflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine and dispatcher settings.
 * Bound from application.yml under the "workflow" prefix.
 */
@ConfigurationProperties(prefix = "workflow")
@Data
public class WorkflowProperties {

    /** Step ceiling; a run that reaches it ends with STEP_LIMIT_EXCEEDED */
    private int maxSteps = 50;

    /** Upper bound on awaiting a single tool handler */
    private Duration toolTimeout = Duration.ofSeconds(30);

    /**
     * true: every call of a turn is dispatched, in order.
     * false: only the first call is executed, the rest are answered as not dispatched.
     */
    private boolean dispatchAllCalls = true;
}
