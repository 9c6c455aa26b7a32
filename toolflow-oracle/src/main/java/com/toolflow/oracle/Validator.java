package com.toolflow.oracle;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Gatekeeper consulted before every tool call.
 *
 * Implementations must not mutate {@code args} or {@code context}.
 */
@FunctionalInterface
public interface Validator {

    /**
     * Decide whether a tool call may run.
     *
     * @param toolName Name of the tool about to run
     * @param args Proposed arguments
     * @param context Caller context
     * @return Acceptance, or rejection with a reason
     */
    ValidationResult check(String toolName, JsonNode args, JsonNode context);
}
