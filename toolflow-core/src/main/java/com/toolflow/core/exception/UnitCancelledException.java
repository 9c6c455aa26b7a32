package com.toolflow.core.exception;

/**
 * Thrown when a unit observes its cancellation token at a checkpoint.
 */
public class UnitCancelledException extends ToolflowException {

    public static final String ERROR_CODE = "CANCELLED";

    public UnitCancelledException(String unitId) {
        super(ERROR_CODE, "Unit cancelled: " + unitId);
    }
}
