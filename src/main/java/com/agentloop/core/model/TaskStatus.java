package com.agentloop.core.model;

/**
 * Status of an individual task within a plan.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /** True once the task will not be scheduled again without a plan revision. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
