package com.agentloop.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A single unit of work within a plan: one invocation of a named capability.
 * <p>
 * Identity, capability, parameters and dependencies are fixed at construction. Status,
 * result, error and timestamps are the only mutable state and are written by the
 * orchestrator thread between waves.
 */
public class Task {

    private final String id;
    private final String planId;
    private final String description;
    private final String capability;
    private final Map<String, Object> parameters;
    private final List<String> dependencies;
    private final Map<String, Object> metadata;

    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile Object result;
    private volatile String error;
    private volatile Instant startedAt;
    private volatile Instant completedAt;

    public Task(String id, String planId, String description, String capability,
                Map<String, Object> parameters, List<String> dependencies,
                Map<String, Object> metadata) {
        this.id = (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
        this.planId = planId;
        this.description = description != null ? description : "";
        this.capability = Objects.requireNonNull(capability, "capability");
        this.parameters = parameters == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        this.metadata = metadata == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Task(String id, String description, String capability,
                Map<String, Object> parameters, List<String> dependencies) {
        this(id, null, description, capability, parameters, dependencies, Map.of());
    }

    /**
     * Fresh pending copy bound to {@code planId}. Used when a plan adopts tasks from the
     * plan generator, so the generator's objects are never mutated.
     */
    public Task copyForPlan(String planId) {
        return new Task(id, planId, description, capability, parameters, dependencies, metadata);
    }

    public String id() { return id; }
    public String planId() { return planId; }
    public String description() { return description; }
    public String capability() { return capability; }
    public Map<String, Object> parameters() { return parameters; }
    public List<String> dependencies() { return dependencies; }
    public Map<String, Object> metadata() { return metadata; }

    public TaskStatus status() { return status; }
    public Object result() { return result; }
    public String error() { return error; }
    public Instant startedAt() { return startedAt; }
    public Instant completedAt() { return completedAt; }

    public void markRunning(Instant at) {
        this.status = TaskStatus.RUNNING;
        this.startedAt = at;
    }

    /**
     * Applies the outcome of an executed attempt group.
     */
    public void applyResult(TaskResult taskResult, Instant startedAt, Instant completedAt) {
        if (taskResult.success()) {
            this.status = TaskStatus.COMPLETED;
            this.result = taskResult.output();
            this.error = null;
        } else {
            this.status = taskResult.cancelled() ? TaskStatus.CANCELLED : TaskStatus.FAILED;
            this.error = taskResult.error();
        }
        if (startedAt != null) {
            this.startedAt = startedAt;
        }
        this.completedAt = completedAt;
    }

    public void markCancelled(String reason) {
        this.status = TaskStatus.CANCELLED;
        this.error = reason;
        this.completedAt = Instant.now();
    }

    /** Expected duration hint from metadata ({@code expected_time_seconds}), or null. */
    public Double expectedTimeSeconds() {
        Object value = metadata.get("expected_time_seconds");
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "Task[" + id + " " + capability + " " + status + "]";
    }
}
