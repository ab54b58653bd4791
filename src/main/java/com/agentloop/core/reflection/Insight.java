package com.agentloop.core.reflection;

import java.util.Map;

/**
 * Observation derived from a finished episode.
 *
 * @param category    {@code tool_effectiveness}, {@code failure_mode} or {@code performance}
 * @param description human-readable observation
 * @param confidence  0.0 to 1.0
 * @param evidence    supporting figures
 */
public record Insight(
    String category,
    String description,
    double confidence,
    Map<String, Object> evidence
) {

    public static final String TOOL_EFFECTIVENESS = "tool_effectiveness";
    public static final String FAILURE_MODE = "failure_mode";
    public static final String PERFORMANCE = "performance";

    public Insight {
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
    }
}
