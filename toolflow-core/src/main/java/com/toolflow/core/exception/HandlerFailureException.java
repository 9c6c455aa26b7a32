package com.toolflow.core.exception;

/**
 * Thrown when a tool handler fails.
 * Carries the handler's own error code so retry policies can tell failures apart.
 */
public class HandlerFailureException extends ToolflowException {

    public static final String ERROR_CODE = "HANDLER_FAILURE";

    private final String toolName;
    private final String handlerErrorCode;
    private final boolean retryable;

    public HandlerFailureException(String toolName, String handlerErrorCode, String message,
                                   boolean retryable, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.toolName = toolName;
        this.handlerErrorCode = handlerErrorCode != null ? handlerErrorCode : ERROR_CODE;
        this.retryable = retryable;
    }

    public String getToolName() {
        return toolName;
    }

    public String getHandlerErrorCode() {
        return handlerErrorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
