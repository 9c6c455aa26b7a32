package com.toolflow.api;

import com.toolflow.engine.config.ToolflowConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * Inspection server for a toolflow engine: tasks, tool runs and the event log over HTTP.
 */
@SpringBootApplication
@Import(ToolflowConfiguration.class)
public class ToolflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolflowApplication.class, args);
    }
}
