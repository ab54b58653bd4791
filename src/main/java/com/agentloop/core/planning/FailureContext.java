package com.agentloop.core.planning;

import com.agentloop.core.model.Evaluation;

/**
 * What the plan generator is told when asked to revise a plan after a task failure.
 *
 * @param failedTaskId       the task whose failure triggered the revision
 * @param error              the task's error text
 * @param evaluation         the evaluator's judgment of the failure
 * @param replanningAttempt  1-based number of this revision request
 */
public record FailureContext(
    String failedTaskId,
    String error,
    Evaluation evaluation,
    int replanningAttempt
) {}
