package com.agentloop.core.model;

import java.util.List;

/**
 * Structured report returned by the orchestrator for every goal that passed plan validation.
 *
 * @param goal               the goal that was executed
 * @param plan               the final plan, after any revisions
 * @param results            one result per executed task of the final plan, in execution order
 * @param success            true iff every task of the final plan completed successfully
 * @param replanningAttempts number of revisions requested from the planner
 * @param awaitingApproval   true only when the autonomy gate blocked execution
 * @param stuck              true when execution stopped because no task could become ready
 * @param blockedTaskIds     tasks left unscheduled by a stuck plan
 * @param failureReason      human-readable reason when the goal did not succeed, or null
 * @param evaluation         plan-level evaluation, or null when nothing ran
 * @param stats              counters over the final plan
 * @param supersededResults  results of tasks that a revision removed from the plan
 * @param episodeId          id of the recorded episode, or null when nothing ran
 * @param waves              number of waves executed
 */
public record GoalResult(
    Goal goal,
    Plan plan,
    List<TaskResult> results,
    boolean success,
    int replanningAttempts,
    boolean awaitingApproval,
    boolean stuck,
    List<String> blockedTaskIds,
    String failureReason,
    Evaluation evaluation,
    ExecutionStats stats,
    List<TaskResult> supersededResults,
    String episodeId,
    int waves
) {

    public GoalResult {
        results = results == null ? List.of() : List.copyOf(results);
        blockedTaskIds = blockedTaskIds == null ? List.of() : List.copyOf(blockedTaskIds);
        supersededResults = supersededResults == null ? List.of() : List.copyOf(supersededResults);
    }

    public static GoalResult awaitingApproval(Goal goal, Plan plan) {
        return new GoalResult(goal, plan, List.of(), false, 0, true, false, List.of(),
                "Plan awaiting approval", null, ExecutionStats.of(plan.tasks()), List.of(), null, 0);
    }
}
