package com.toolflow.engine.workflow;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Settled result of one unit in a graph run: a value or an error, never both.
 */
public record UnitOutcome(
    String id,
    boolean fulfilled,
    JsonNode value,
    Throwable error
) {
    public static UnitOutcome fulfilled(String id, JsonNode value) {
        return new UnitOutcome(id, true, value, null);
    }

    public static UnitOutcome rejected(String id, Throwable error) {
        return new UnitOutcome(id, false, null, error);
    }

    public boolean rejected() {
        return !fulfilled;
    }
}
