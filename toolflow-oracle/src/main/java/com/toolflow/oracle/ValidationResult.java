package com.toolflow.oracle;

/**
 * Outcome of validating a proposed tool call.
 *
 * @param accepted whether the call may run
 * @param reason why it was rejected, or a note on why it was accepted
 */
public record ValidationResult(boolean accepted, String reason) {

    public static ValidationResult accept() {
        return new ValidationResult(true, null);
    }

    public static ValidationResult accept(String note) {
        return new ValidationResult(true, note);
    }

    public static ValidationResult reject(String reason) {
        return new ValidationResult(false, reason != null ? reason : "rejected");
    }
}
