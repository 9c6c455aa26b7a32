package com.toolflow.oracle.rule;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Rejects calls to one tool whose arguments lack a non-empty field.
 */
public class RequiredFieldRule implements ValidationRule {

    private final String toolName;
    private final String field;

    public RequiredFieldRule(String toolName, String field) {
        this.toolName = toolName;
        this.field = field;
    }

    @Override
    public Optional<String> violation(String calledTool, JsonNode args, JsonNode context) {
        if (!toolName.equals(calledTool)) {
            return Optional.empty();
        }
        JsonNode value = args != null ? args.get(field) : null;
        if (value == null || value.isNull() || (value.isTextual() && value.asText().isEmpty())) {
            return Optional.of(toolName + " requires a " + field + " field");
        }
        return Optional.empty();
    }
}
