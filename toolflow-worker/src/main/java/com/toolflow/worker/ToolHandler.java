package com.toolflow.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Interface for tool implementations.
 * A handler is invoked exactly once per accepted call; it never retries itself.
 */
@FunctionalInterface
public interface ToolHandler {

    /**
     * Execute the tool.
     *
     * @param args Tool arguments, possibly replaced by the rectifier
     * @param context Caller context (project root, task id, ...)
     * @param hooks Progress logging and cancellation
     * @return The tool result
     * @throws ToolException if the tool fails
     */
    JsonNode execute(JsonNode args, JsonNode context, ToolHooks hooks) throws ToolException;
}
