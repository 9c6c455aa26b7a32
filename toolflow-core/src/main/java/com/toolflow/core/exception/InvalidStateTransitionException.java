package com.toolflow.core.exception;

import com.toolflow.core.model.TaskStatus;

/**
 * Thrown when a task or step is moved to a status its current status does not allow.
 */
public class InvalidStateTransitionException extends ToolflowException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String entityType, TaskStatus currentStatus, TaskStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s from %s to %s",
            entityType, currentStatus.wireName(), targetStatus.wireName()
        ));
    }
}
