package com.toolflow.api.rest;

import com.toolflow.core.exception.NotFoundException;
import com.toolflow.core.exception.ToolflowException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps engine errors to JSON error bodies.
 */
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalApiExceptionHandler.class);

    static final String BAD_REQUEST = "BAD_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    public record ApiError(String code, String message, String path) {}

    @ExceptionHandler(ToolflowException.class)
    public ResponseEntity<ApiError> handleToolflowException(ToolflowException ex, HttpServletRequest request) {
        HttpStatus status = NotFoundException.ERROR_CODE.equals(ex.getErrorCode())
            ? HttpStatus.NOT_FOUND
            : HttpStatus.BAD_REQUEST;
        log.warn("HTTP_ERROR path={}, method={}, errorCode={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status)
            .body(new ApiError(ex.getErrorCode(), ex.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), ex.getMessage());
        return ResponseEntity.badRequest()
            .body(new ApiError(BAD_REQUEST, ex.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(INTERNAL_ERROR, "Internal error", request.getRequestURI()));
    }
}
