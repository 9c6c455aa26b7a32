package com.toolflow.core.exception;

/**
 * Thrown when a step graph handed to the engine is malformed.
 */
public class WorkflowValidationException extends ToolflowException {

    public static final String ERROR_CODE = "WORKFLOW_VALIDATION_FAILED";

    public WorkflowValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public WorkflowValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid workflow graph: %s - %s", field, reason));
    }
}
