package com.agentloop.core.graph;

import com.agentloop.core.model.Plan;
import com.agentloop.core.model.Task;
import com.agentloop.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dependency view over a {@link Plan}: validates that the tasks form a DAG and answers
 * which tasks can run now.
 * <p>
 * The graph reads the plan's live task list, so status changes made by the orchestrator are
 * visible immediately. Structural changes (a revision) must be followed by another
 * {@link #validate()}.
 */
public class PlanGraph {

    private static final Logger log = LoggerFactory.getLogger(PlanGraph.class);

    private enum Color { WHITE, GRAY, BLACK }

    private final Plan plan;

    public PlanGraph(Plan plan) {
        this.plan = plan;
    }

    public Plan plan() {
        return plan;
    }

    /**
     * Checks task id uniqueness, dependency references and acyclicity. Read-only and
     * idempotent.
     *
     * @throws PlanStructureException on the first defect found
     */
    public void validate() {
        var byId = new LinkedHashMap<String, Task>();
        for (var task : plan.tasks()) {
            if (byId.putIfAbsent(task.id(), task) != null) {
                throw new PlanStructureException(PlanStructureException.Kind.DUPLICATE_ID,
                        "Duplicate task id in plan " + plan.id() + ": " + task.id(), List.of(task.id()));
            }
        }

        for (var task : byId.values()) {
            for (var dep : task.dependencies()) {
                if (dep.equals(task.id())) {
                    throw new PlanStructureException(PlanStructureException.Kind.SELF_DEPENDENCY,
                            "Task " + task.id() + " depends on itself", List.of(task.id()));
                }
                if (!byId.containsKey(dep)) {
                    throw new PlanStructureException(PlanStructureException.Kind.DANGLING_DEPENDENCY,
                            "Task " + task.id() + " depends on unknown task " + dep, List.of(task.id(), dep));
                }
            }
        }

        var colors = new HashMap<String, Color>();
        for (var id : byId.keySet()) {
            colors.put(id, Color.WHITE);
        }
        for (var id : byId.keySet()) {
            if (colors.get(id) == Color.WHITE) {
                var path = new ArrayList<String>();
                var cycle = visit(id, byId, colors, path);
                if (cycle != null) {
                    throw new PlanStructureException(PlanStructureException.Kind.CYCLE,
                            "Dependency cycle in plan " + plan.id() + ": " + String.join(" -> ", cycle), cycle);
                }
            }
        }
        log.debug("Plan {} validated: {} tasks", plan.id(), byId.size());
    }

    /**
     * Depth-first visit with an explicit stack; GRAY marks the tasks on the current path.
     * Returns the cycle path when a back edge is found, otherwise null.
     */
    private List<String> visit(String root, Map<String, Task> byId, Map<String, Color> colors, List<String> path) {
        var stack = new ArrayDeque<Frame>();
        colors.put(root, Color.GRAY);
        path.add(root);
        stack.push(new Frame(byId.get(root)));
        while (!stack.isEmpty()) {
            var frame = stack.peek();
            var deps = frame.task.dependencies();
            if (frame.next == deps.size()) {
                stack.pop();
                path.remove(path.size() - 1);
                colors.put(frame.task.id(), Color.BLACK);
                continue;
            }
            var dep = deps.get(frame.next++);
            var color = colors.get(dep);
            if (color == Color.GRAY) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                cycle.add(dep);
                return cycle;
            }
            if (color == Color.WHITE) {
                colors.put(dep, Color.GRAY);
                path.add(dep);
                stack.push(new Frame(byId.get(dep)));
            }
        }
        return null;
    }

    private static final class Frame {
        final Task task;
        int next;

        Frame(Task task) {
            this.task = task;
        }
    }

    /**
     * Pending tasks whose dependencies have all completed, in declaration order.
     */
    public List<Task> readyTasks() {
        Set<String> completedIds = new HashSet<>();
        for (var task : plan.tasks()) {
            if (task.status() == TaskStatus.COMPLETED) {
                completedIds.add(task.id());
            }
        }

        var ready = new ArrayList<Task>();
        for (var task : plan.tasks()) {
            if (task.status() != TaskStatus.PENDING) {
                continue;
            }
            if (completedIds.containsAll(task.dependencies())) {
                log.debug("  {} [{}] ready (deps: {})", task.id(), task.capability(), task.dependencies());
                ready.add(task);
            } else {
                log.debug("  {} [{}] deps unsatisfied: {}", task.id(), task.capability(), task.dependencies());
            }
        }
        return ready;
    }

    public Optional<Task> getTask(String taskId) {
        return plan.getTask(taskId);
    }

    /** True when no task is pending or running. */
    public boolean allFinished() {
        return plan.tasks().stream().allMatch(t -> t.status().isTerminal());
    }

    /** Pending tasks that can no longer become ready. Meaningful when {@link #readyTasks()} is empty. */
    public List<String> blockedTaskIds() {
        return plan.tasks().stream()
                .filter(t -> t.status() == TaskStatus.PENDING)
                .map(Task::id)
                .toList();
    }

    /**
     * Length of the longest dependency chain, counted in tasks. Assumes a validated graph.
     */
    public int longestChain() {
        var depth = new HashMap<String, Integer>();
        var byId = new HashMap<String, Task>();
        for (var task : plan.tasks()) byId.put(task.id(), task);
        int longest = 0;
        for (var task : plan.tasks()) {
            longest = Math.max(longest, depthOf(task, byId, depth));
        }
        return longest;
    }

    private int depthOf(Task root, Map<String, Task> byId, Map<String, Integer> memo) {
        var stack = new ArrayDeque<Task>();
        var expanded = new HashSet<String>();
        stack.push(root);
        while (!stack.isEmpty()) {
            var task = stack.peek();
            if (memo.containsKey(task.id())) {
                stack.pop();
                continue;
            }
            int best = 0;
            boolean resolved = true;
            boolean revisit = !expanded.add(task.id());
            for (var dep : task.dependencies()) {
                var depTask = byId.get(dep);
                if (depTask == null) {
                    continue;
                }
                var depth = memo.get(dep);
                if (depth == null) {
                    // unresolved on a second pass means a cycle: count the edge as zero
                    if (!revisit) {
                        resolved = false;
                        stack.push(depTask);
                    }
                } else {
                    best = Math.max(best, depth);
                }
            }
            if (resolved) {
                stack.pop();
                memo.put(task.id(), best + 1);
            }
        }
        return memo.get(root.id());
    }
}
