package com.agentloop.core.reflection;

import java.util.List;

/**
 * A recurring failure across several tasks of one plan.
 *
 * @param patternType  {@code repeated_errors}, {@code sequential_failures} or {@code tool_failure}
 * @param description  human-readable summary
 * @param occurrences  number of tasks involved
 * @param taskIds      affected tasks in declaration order
 */
public record FailurePattern(
    String patternType,
    String description,
    int occurrences,
    List<String> taskIds
) {

    public static final String REPEATED_ERRORS = "repeated_errors";
    public static final String SEQUENTIAL_FAILURES = "sequential_failures";
    public static final String TOOL_FAILURE = "tool_failure";

    public FailurePattern {
        taskIds = taskIds == null ? List.of() : List.copyOf(taskIds);
    }
}
