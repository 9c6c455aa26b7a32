package com.toolflow.core.exception;

/**
 * Thrown when a unit cannot run because one of its dependencies did not complete.
 */
public class DependencyFailedException extends ToolflowException {

    public static final String ERROR_CODE = "DEPENDENCY_FAILED";

    private final String dependencyId;

    public DependencyFailedException(String dependencyId) {
        super(ERROR_CODE, "Dependency failed: " + dependencyId);
        this.dependencyId = dependencyId;
    }

    public String getDependencyId() {
        return dependencyId;
    }
}
