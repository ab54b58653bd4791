package com.agentloop.core.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Record of one goal execution handed to the external memory store.
 */
public record Episode(
    String id,
    String goalId,
    Plan plan,
    List<TaskResult> results,
    boolean success,
    Instant createdAt
) {

    public Episode {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static Episode of(Plan plan, List<TaskResult> results, boolean success) {
        return new Episode(UUID.randomUUID().toString(), plan.goal().id(), plan, results, success, Instant.now());
    }
}
