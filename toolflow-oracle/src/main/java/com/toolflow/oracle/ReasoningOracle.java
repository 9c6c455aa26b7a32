package com.toolflow.oracle;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * External reasoning service (typically an LLM) backing the validator and rectifier.
 *
 * The oracle only answers questions. It never executes tools and never mutates
 * engine state; callers interpret its free-text answer.
 */
@FunctionalInterface
public interface ReasoningOracle {

    /**
     * Ask the oracle a question.
     *
     * @param mode What the answer will be used for
     * @param prompt The full prompt
     * @param context Caller context, passed through for routing or auditing
     * @return Raw response text, expected to contain JSON
     * @throws OracleUnavailableException if the oracle could not answer
     */
    String ask(OracleMode mode, String prompt, JsonNode context) throws OracleUnavailableException;
}
