package com.toolflow.core.exception;

/**
 * Thrown when the validator rejects a tool call and no usable correction was proposed.
 * No tool handler runs when this is thrown.
 */
public class ValidationRejectedException extends ToolflowException {

    public static final String ERROR_CODE = "VALIDATION_REJECTED";

    private final String toolName;
    private final String reason;

    public ValidationRejectedException(String toolName, String reason, boolean rectificationAttempted) {
        super(ERROR_CODE, rectificationAttempted
            ? String.format("Tool call %s rejected by validator and rectifier could not fix: %s", toolName, reason)
            : String.format("Tool call %s rejected by validator: %s", toolName, reason));
        this.toolName = toolName;
        this.reason = reason;
    }

    public String getToolName() {
        return toolName;
    }

    public String getReason() {
        return reason;
    }
}
