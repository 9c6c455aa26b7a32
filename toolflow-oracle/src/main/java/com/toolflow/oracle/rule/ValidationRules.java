package com.toolflow.oracle.rule;

import java.util.List;

/**
 * Stock rule sets.
 */
public final class ValidationRules {

    private ValidationRules() {
    }

    /**
     * Patches must carry a patch body, and side effects need an explicit opt-in.
     */
    public static List<ValidationRule> defaults() {
        return List.of(
            new RequiredFieldRule("apply_patch", "patch"),
            new SideEffectOptInRule()
        );
    }
}
