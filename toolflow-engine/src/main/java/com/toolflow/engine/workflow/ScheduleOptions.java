package com.toolflow.engine.workflow;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-unit scheduling options. Null fields fall back to the engine defaults.
 *
 * @param dependsOn ids that must complete before the unit runs
 * @param retries additional attempts after the first failure
 * @param dependencyTimeout bound on the dependency wait
 * @param title title used when the unit's task does not exist yet
 */
public record ScheduleOptions(
    Set<String> dependsOn,
    Integer retries,
    Duration dependencyTimeout,
    String title
) {
    public ScheduleOptions {
        dependsOn = dependsOn != null ? Set.copyOf(dependsOn) : Set.of();
        if (retries != null && retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0");
        }
    }

    public static ScheduleOptions defaults() {
        return new ScheduleOptions(Set.of(), null, null, null);
    }

    public static ScheduleOptions dependsOn(Collection<String> ids) {
        return new ScheduleOptions(new LinkedHashSet<>(ids), null, null, null);
    }

    public ScheduleOptions withRetries(int retryCount) {
        return new ScheduleOptions(dependsOn, retryCount, dependencyTimeout, title);
    }

    public ScheduleOptions withDependencyTimeout(Duration timeout) {
        return new ScheduleOptions(dependsOn, retries, timeout, title);
    }

    public ScheduleOptions withTitle(String unitTitle) {
        return new ScheduleOptions(dependsOn, retries, dependencyTimeout, unitTitle);
    }
}
