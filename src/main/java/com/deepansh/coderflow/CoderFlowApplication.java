package com.deepansh.coderflow;

import com.deepansh.coderflow.config.ToolProperties;
import com.deepansh.coderflow.config.WorkflowProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({WorkflowProperties.class, ToolProperties.class})
public class CoderFlowApplication {
    public static void main(String[] args) {
        SpringApplication.run(CoderFlowApplication.class, args);
    }
}
