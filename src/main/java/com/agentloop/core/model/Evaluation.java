package com.agentloop.core.model;

import java.util.List;

/**
 * Structured judgment over a task or a whole plan. Exactly one of {@code taskId} and
 * {@code planId} is set.
 *
 * @param taskId       evaluated task, or null for a plan evaluation
 * @param planId       evaluated plan, or null for a task evaluation
 * @param success      overall verdict
 * @param confidence   0.0 to 1.0
 * @param issues       detected problems, most important first
 * @param suggestions  suggested fixes
 * @param shouldReplan whether asking the planner for a revision is worthwhile
 */
public record Evaluation(
    String taskId,
    String planId,
    boolean success,
    double confidence,
    List<String> issues,
    List<String> suggestions,
    boolean shouldReplan
) {

    public Evaluation {
        if ((taskId == null) == (planId == null)) {
            throw new IllegalArgumentException("Evaluation must target exactly one of task or plan");
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        issues = issues == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static Evaluation forTask(String taskId, boolean success, double confidence,
                                     List<String> issues, List<String> suggestions, boolean shouldReplan) {
        return new Evaluation(taskId, null, success, confidence, issues, suggestions, shouldReplan);
    }

    public static Evaluation forPlan(String planId, boolean success, double confidence,
                                     List<String> issues, List<String> suggestions, boolean shouldReplan) {
        return new Evaluation(null, planId, success, confidence, issues, suggestions, shouldReplan);
    }
}
