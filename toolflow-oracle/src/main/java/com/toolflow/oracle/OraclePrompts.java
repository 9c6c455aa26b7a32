package com.toolflow.oracle;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Prompt templates sent to the reasoning oracle.
 */
final class OraclePrompts {

    private OraclePrompts() {
    }

    static String validate(String toolName, JsonNode args, JsonNode context) {
        return String.format(
            "You are a validator. Briefly state whether calling tool \"%s\" with args %s is appropriate "
                + "in project context: %s. Answer JSON {\"accepted\": bool, \"reason\": \"...\"}.",
            toolName, args, projectRoot(context));
    }

    static String rectify(String toolName, JsonNode args, JsonNode context, String reason) {
        return String.format(
            "Tool call validation failed for tool \"%s\" with args %s. Reason: %s. "
                + "Provide corrected args JSON or return {\"rejected\":true}. ProjectRoot: %s.%n"
                + "Return only JSON like: { \"args\": { ... } }",
            toolName, args, reason, projectRoot(context));
    }

    private static String projectRoot(JsonNode context) {
        if (context == null) {
            return "unknown";
        }
        JsonNode root = context.get("projectRoot");
        return root != null && !root.isNull() ? root.asText() : "unknown";
    }
}
