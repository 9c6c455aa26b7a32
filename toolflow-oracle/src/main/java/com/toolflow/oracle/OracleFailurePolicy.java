package com.toolflow.oracle;

import java.util.Locale;

/**
 * What the validator decides when the reasoning oracle gives no usable verdict
 * (unparseable answer, missing field, or oracle failure).
 */
public enum OracleFailurePolicy {

    /**
     * Accept the call. Favors availability: a broken oracle never blocks tools.
     */
    FAIL_OPEN,

    /**
     * Reject the call. Favors strictness: only an explicit verdict lets a call through.
     */
    FAIL_CLOSED;

    public ValidationResult verdict(String detail) {
        return this == FAIL_OPEN
            ? ValidationResult.accept(detail + "; default accept")
            : ValidationResult.reject(detail + "; default reject");
    }

    /**
     * Parse a configuration value such as {@code fail-open} or {@code FAIL_CLOSED}.
     */
    public static OracleFailurePolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return FAIL_OPEN;
        }
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
