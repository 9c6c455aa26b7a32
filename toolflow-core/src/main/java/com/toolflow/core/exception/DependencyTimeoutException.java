package com.toolflow.core.exception;

import java.time.Duration;
import java.util.Set;

/**
 * Thrown when a unit's dependencies did not settle within the wait bound.
 * A dependency cycle between individually scheduled units ends this way.
 */
public class DependencyTimeoutException extends ToolflowException {

    public static final String ERROR_CODE = "TIMEOUT";

    private final String unitId;

    public DependencyTimeoutException(String unitId, Set<String> pending, Duration timeout) {
        super(ERROR_CODE, String.format(
            "Unit %s timed out after %d ms waiting for %s",
            unitId, timeout.toMillis(), pending
        ));
        this.unitId = unitId;
    }

    public String getUnitId() {
        return unitId;
    }
}
