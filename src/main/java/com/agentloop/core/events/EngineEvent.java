package com.agentloop.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during goal execution for external sinks (plugins, telemetry, UIs).
 *
 * @param eventType event type (e.g. "plan.created", "task.started", "episode.recorded")
 * @param goalId    the goal this event belongs to
 * @param taskId    the task this event relates to (nullable for goal-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record EngineEvent(
    String eventType,
    String goalId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static EngineEvent of(String eventType, String goalId, String taskId, Map<String, Object> payload) {
        return new EngineEvent(eventType, goalId, taskId, payload, Instant.now());
    }
}
