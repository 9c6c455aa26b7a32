package com.toolflow.core.exception;

/**
 * Thrown when no handler is registered under the requested tool name.
 */
public class UnknownToolException extends ToolflowException {

    public static final String ERROR_CODE = "UNKNOWN_TOOL";

    public UnknownToolException(String toolName) {
        super(ERROR_CODE, "Unknown tool: " + toolName);
    }
}
