package com.agentloop.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * An ordered collection of tasks forming a DAG for one goal.
 * <p>
 * Owned by the orchestrator for the duration of one goal execution. Declaration order
 * is preserved and drives ready-task ordering.
 */
public class Plan {

    private final String id;
    private final Goal goal;
    private final List<Task> tasks = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Instant createdAt;

    private PlanStatus status = PlanStatus.DRAFT;
    private Instant approvedAt;
    private Instant startedAt;
    private Instant completedAt;
    private int revision;

    public Plan(String id, Goal goal) {
        this.id = (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
        this.goal = goal;
        this.createdAt = Instant.now();
    }

    /**
     * Builds a draft plan adopting pending copies of the generated tasks.
     */
    public static Plan of(Goal goal, List<Task> generated) {
        var plan = new Plan(null, goal);
        for (var task : generated) {
            plan.tasks.add(task.copyForPlan(plan.id));
        }
        return plan;
    }

    public String id() { return id; }
    public Goal goal() { return goal; }
    public PlanStatus status() { return status; }
    public Instant createdAt() { return createdAt; }
    public Instant approvedAt() { return approvedAt; }
    public Instant startedAt() { return startedAt; }
    public Instant completedAt() { return completedAt; }
    public int revision() { return revision; }
    public Map<String, Object> metadata() { return metadata; }

    /** Tasks in declaration order. */
    public List<Task> tasks() {
        return Collections.unmodifiableList(tasks);
    }

    public Optional<Task> getTask(String taskId) {
        return tasks.stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    public void addTask(Task task) {
        tasks.add(task.planId() != null && task.planId().equals(id) ? task : task.copyForPlan(id));
    }

    public void markExecuting() {
        var now = Instant.now();
        this.approvedAt = now;
        this.startedAt = now;
        this.status = PlanStatus.EXECUTING;
    }

    public void finish(PlanStatus finalStatus) {
        this.status = finalStatus;
        this.completedAt = Instant.now();
    }

    /**
     * Merges a revised task list into this plan.
     * <p>
     * Completed tasks are kept as they are. Every revised task whose id is not a completed
     * task is adopted as a fresh pending task, replacing any task with the same id. Failed
     * tasks the revision does not name stay failed, except {@code replacedTaskId}, the failure
     * the revision was requested for. Any other task the revision does not name is dropped.
     *
     * @param revised        the planner's revised task list
     * @param replacedTaskId the failed task the revision answers; may be dropped
     * @return ids of the tasks dropped from the plan
     */
    public List<String> applyRevision(List<Task> revised, String replacedTaskId) {
        Map<String, Task> kept = new HashMap<>();
        for (var task : tasks) {
            if (task.status() == TaskStatus.COMPLETED) {
                kept.put(task.id(), task);
            }
        }
        Set<String> revisedIds = revised.stream().map(Task::id).collect(Collectors.toSet());
        for (var task : tasks) {
            if (task.status() == TaskStatus.FAILED && !task.id().equals(replacedTaskId)
                    && !revisedIds.contains(task.id())) {
                kept.put(task.id(), task);
            }
        }

        var dropped = new ArrayList<String>();
        var merged = new ArrayList<Task>();
        for (var task : tasks) {
            if (kept.containsKey(task.id())) {
                merged.add(task);
            } else if (!revisedIds.contains(task.id())) {
                dropped.add(task.id());
            }
        }
        for (var task : revised) {
            if (!kept.containsKey(task.id())) {
                merged.add(task.copyForPlan(id));
            }
        }

        tasks.clear();
        tasks.addAll(merged);
        revision++;
        return dropped;
    }

    public boolean allTasksCompleted() {
        return tasks.stream().allMatch(t -> t.status() == TaskStatus.COMPLETED);
    }

    @Override
    public String toString() {
        return "Plan[" + id + " " + status + " tasks=" + tasks.size() + " rev=" + revision + "]";
    }
}
