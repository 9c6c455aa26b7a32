package com.toolflow.oracle;

/**
 * Thrown by a {@link ReasoningOracle} that could not produce an answer.
 */
public class OracleUnavailableException extends Exception {

    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
