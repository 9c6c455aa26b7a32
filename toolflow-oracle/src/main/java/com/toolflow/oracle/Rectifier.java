package com.toolflow.oracle;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Repairs the arguments of a rejected tool call.
 *
 * A proposal replaces the original arguments wholesale and is used for exactly
 * one attempt. Implementations do not loop; bounding attempts is up to the caller.
 */
@FunctionalInterface
public interface Rectifier {

    /**
     * @param toolName Name of the rejected tool
     * @param args Rejected arguments
     * @param context Caller context
     * @param reason Rejection reason from the validator
     * @return Replacement arguments, or empty to keep the rejection
     */
    Optional<JsonNode> propose(String toolName, JsonNode args, JsonNode context, String reason);
}
