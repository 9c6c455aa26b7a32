package com.toolflow.oracle.rule;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Blocks side-effecting calls that do not opt in explicitly.
 * A call is side-effecting when {@code args.sideEffect} is true; it opts in with
 * {@code args.allowSideEffects == true}.
 */
public class SideEffectOptInRule implements ValidationRule {

    public static final String SIDE_EFFECT = "sideEffect";
    public static final String ALLOW_SIDE_EFFECTS = "allowSideEffects";

    @Override
    public Optional<String> violation(String toolName, JsonNode args, JsonNode context) {
        if (args == null) {
            return Optional.empty();
        }
        boolean sideEffect = args.path(SIDE_EFFECT).asBoolean(false);
        boolean allowed = args.path(ALLOW_SIDE_EFFECTS).asBoolean(false);
        if (sideEffect && !allowed) {
            return Optional.of("Side-effecting tool call blocked: missing " + ALLOW_SIDE_EFFECTS + "=true");
        }
        return Optional.empty();
    }
}
