package com.toolflow.core.exception;

/**
 * Base exception for all engine errors.
 */
public class ToolflowException extends RuntimeException {

    private final String errorCode;

    public ToolflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ToolflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
