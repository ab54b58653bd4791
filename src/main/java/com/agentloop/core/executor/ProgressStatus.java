package com.agentloop.core.executor;

/**
 * Stage of a task as reported through {@link ProgressTracker}.
 */
public enum ProgressStatus {
    STARTING,
    IN_PROGRESS,
    COMPLETING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isFinal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
