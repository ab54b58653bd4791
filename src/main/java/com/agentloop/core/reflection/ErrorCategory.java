package com.agentloop.core.reflection;

import java.util.List;
import java.util.Locale;

/**
 * Classification of task error text. Categories are tried in declaration order and the
 * first one with a matching keyword wins; {@link #EXECUTION} catches everything else.
 */
public enum ErrorCategory {

    TIMEOUT("timeout", true,
            "Task exceeded its time limit",
            "Increase the timeout or split the work into smaller tasks",
            List.of("timeout", "timed out")),
    PERMISSION("permission", false,
            "Task was denied access",
            "Check credentials and permissions for the capability",
            List.of("permission", "access denied", "forbidden", "unauthorized", "not permitted")),
    NOT_FOUND("not_found", true,
            "A required resource was not found",
            "Verify that the referenced resource exists or add a task that creates it",
            List.of("not found", "no such", "does not exist", "missing")),
    NETWORK("network", true,
            "Network problem while running the task",
            "Check connectivity and retry, or use an alternative source",
            List.of("network", "connection", "unreachable", "dns", "socket")),
    VALIDATION("validation", false,
            "Task parameters were rejected",
            "Fix the task parameters to match what the capability accepts",
            List.of("invalid", "validation", "malformed", "bad request")),
    RESOURCE("resource", true,
            "Task ran out of resources",
            "Reduce the workload per task or free resources before retrying",
            List.of("memory", "resource", "quota", "disk space", "too many")),
    EXECUTION("execution", false,
            "Task failed during execution",
            "Inspect the task logs and adjust the approach",
            List.of());

    private final String key;
    private final boolean replanWorthwhile;
    private final String issue;
    private final String suggestion;
    private final List<String> keywords;

    ErrorCategory(String key, boolean replanWorthwhile, String issue, String suggestion, List<String> keywords) {
        this.key = key;
        this.replanWorthwhile = replanWorthwhile;
        this.issue = issue;
        this.suggestion = suggestion;
        this.keywords = keywords;
    }

    public static ErrorCategory classify(String error) {
        if (error == null || error.isBlank()) {
            return EXECUTION;
        }
        String text = error.toLowerCase(Locale.ROOT);
        for (var category : values()) {
            for (var keyword : category.keywords) {
                if (text.contains(keyword)) {
                    return category;
                }
            }
        }
        return EXECUTION;
    }

    /** Lowercase name used in issues, patterns and metric tags. */
    public String key() { return key; }

    /** Whether asking the planner for a revision is expected to help. */
    public boolean replanWorthwhile() { return replanWorthwhile; }

    public String issue() { return issue; }

    public String suggestion() { return suggestion; }
}
