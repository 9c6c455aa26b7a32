package com.toolflow.worker;

/**
 * Exception thrown by tool handlers on failure.
 */
public class ToolException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public ToolException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = true;
    }

    public ToolException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public ToolException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = true;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static ToolException permanent(String errorCode, String message) {
        return new ToolException(errorCode, message, false);
    }
}
