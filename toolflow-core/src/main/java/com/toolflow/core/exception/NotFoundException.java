package com.toolflow.core.exception;

/**
 * Thrown when a referenced task or step does not exist.
 */
public class NotFoundException extends ToolflowException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
