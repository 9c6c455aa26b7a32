package com.toolflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.toolflow.core.exception.InvalidStateTransitionException;

import java.util.Locale;

/**
 * Lifecycle states shared by tasks and their steps.
 */
public enum TaskStatus {
    /**
     * Created, not yet started.
     * Transitions: -> RUNNING, CANCELLED
     */
    PENDING,

    /**
     * Work is in progress.
     * Transitions: -> COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Finished successfully. Terminal state.
     */
    COMPLETED,

    /**
     * Finished with an error. Terminal state.
     */
    FAILED,

    /**
     * Abandoned before finishing. Terminal state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if a transition from this status to the target is allowed.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    /**
     * Throw if the transition to the target is not allowed.
     *
     * @param entityType "Task" or "Step", used in the error message
     */
    public void checkTransition(TaskStatus target, String entityType) {
        if (!canTransitionTo(target)) {
            throw new InvalidStateTransitionException(entityType, this, target);
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus fromWireName(String value) {
        return TaskStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
