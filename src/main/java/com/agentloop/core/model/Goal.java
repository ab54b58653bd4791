package com.agentloop.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A user goal handed to the orchestrator. Immutable.
 *
 * @param id          unique identifier
 * @param description free-text description of what should be achieved
 * @param constraints constraints the planner should respect (e.g. {@code max_time_seconds})
 * @param context     additional context for the planner
 * @param priority    1 (lowest) to 10 (highest)
 */
public record Goal(
    String id,
    String description,
    Map<String, Object> constraints,
    Map<String, Object> context,
    int priority
) {

    public static final int DEFAULT_PRIORITY = 5;

    public Goal {
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        constraints = constraints == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public Goal(String description) {
        this(null, description, Map.of(), Map.of(), DEFAULT_PRIORITY);
    }
}
