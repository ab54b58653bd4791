package com.agentloop.core.graph;

import java.util.List;

/**
 * Thrown when a plan's dependency structure cannot be executed: a cycle, a self-dependency,
 * a dependency on an unknown task, or a duplicated task id. Fatal for the goal.
 */
public class PlanStructureException extends RuntimeException {

    public enum Kind { CYCLE, SELF_DEPENDENCY, DANGLING_DEPENDENCY, DUPLICATE_ID }

    private final Kind kind;
    private final List<String> taskIds;

    public PlanStructureException(Kind kind, String message, List<String> taskIds) {
        super(message);
        this.kind = kind;
        this.taskIds = List.copyOf(taskIds);
    }

    public Kind kind() {
        return kind;
    }

    /** Task ids involved in the defect; for a cycle, the cycle path in order. */
    public List<String> taskIds() {
        return taskIds;
    }
}
