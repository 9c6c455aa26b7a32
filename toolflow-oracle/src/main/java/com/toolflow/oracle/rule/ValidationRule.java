package com.toolflow.oracle.rule;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * A static check evaluated before any oracle is consulted.
 */
@FunctionalInterface
public interface ValidationRule {

    /**
     * @return the rejection reason, or empty if the call passes this rule
     */
    Optional<String> violation(String toolName, JsonNode args, JsonNode context);
}
