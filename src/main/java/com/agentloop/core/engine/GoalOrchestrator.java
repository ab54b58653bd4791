package com.agentloop.core.engine;

import com.agentloop.core.capability.CapabilityInvoker;
import com.agentloop.core.config.AgentloopProperties;
import com.agentloop.core.events.EngineEvent;
import com.agentloop.core.events.EventBus;
import com.agentloop.core.executor.ProgressListener;
import com.agentloop.core.executor.TaskExecutor;
import com.agentloop.core.executor.TaskExecutorFactory;
import com.agentloop.core.graph.PlanGraph;
import com.agentloop.core.graph.PlanStructureException;
import com.agentloop.core.logging.MdcContext;
import com.agentloop.core.memory.EpisodeRecorder;
import com.agentloop.core.metrics.EngineMetrics;
import com.agentloop.core.model.AutonomyLevel;
import com.agentloop.core.model.Episode;
import com.agentloop.core.model.Evaluation;
import com.agentloop.core.model.ExecutionStats;
import com.agentloop.core.model.Goal;
import com.agentloop.core.model.GoalResult;
import com.agentloop.core.model.Plan;
import com.agentloop.core.model.PlanStatus;
import com.agentloop.core.model.Task;
import com.agentloop.core.model.TaskResult;
import com.agentloop.core.model.TaskStatus;
import com.agentloop.core.planning.FailureContext;
import com.agentloop.core.planning.PlanGenerator;
import com.agentloop.core.reflection.ErrorCategory;
import com.agentloop.core.reflection.Reflector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives one goal from plan generation to a {@link GoalResult}.
 * <p>
 * The control loop runs on the calling thread and executes one wave of ready tasks at a
 * time; only the tasks inside a wave run concurrently. After each wave the failed tasks are
 * evaluated and at most one plan revision is requested. The plan is only mutated here,
 * between waves.
 * <p>
 * Structural plan errors propagate as {@link PlanStructureException}. Every other outcome,
 * including an unavailable planner or a stuck or cancelled plan, is reported in the returned
 * result.
 */
@Service
public class GoalOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GoalOrchestrator.class);

    private final PlanGenerator planGenerator;
    private final CapabilityInvoker capabilityInvoker;
    private final Reflector reflector;
    private final EpisodeRecorder episodeRecorder;
    private final EventBus eventBus;
    private final EngineMetrics metrics;
    private final AgentloopProperties properties;
    private final TaskExecutorFactory executorFactory;

    private final ConcurrentHashMap<String, ActiveRun> activeRuns = new ConcurrentHashMap<>();

    public GoalOrchestrator(PlanGenerator planGenerator, CapabilityInvoker capabilityInvoker,
                            Reflector reflector, EpisodeRecorder episodeRecorder, EventBus eventBus,
                            EngineMetrics metrics, AgentloopProperties properties,
                            TaskExecutorFactory executorFactory) {
        this.planGenerator = planGenerator;
        this.capabilityInvoker = capabilityInvoker;
        this.reflector = reflector;
        this.episodeRecorder = episodeRecorder;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.executorFactory = executorFactory;
    }

    /**
     * Executes a goal with the configured autonomy level.
     */
    public GoalResult execute(Goal goal) {
        return execute(goal, properties.getOrchestrator().getAutonomy());
    }

    /**
     * Executes a goal.
     *
     * @param goal     the goal to execute
     * @param autonomy trust level; {@link AutonomyLevel#PARANOID} returns the validated plan
     *                 for approval without running anything
     * @return the structured report for the goal
     * @throws PlanStructureException if the generated or a revised plan is not a valid DAG
     */
    public GoalResult execute(Goal goal, AutonomyLevel autonomy) {
        MdcContext.setGoal(goal.id());
        try {
            log.info("Starting goal {} with autonomy {}: {}", goal.id(), autonomy, goal.description());

            List<Task> generated;
            try {
                generated = planGenerator.generatePlan(goal, capabilityInvoker.capabilityNames());
            } catch (Exception e) {
                log.warn("Plan generation failed for goal {}: {}", goal.id(), e.getMessage(), e);
                var reason = "Plan generator unavailable: "
                        + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                return failedBeforeExecution(goal, new Plan(null, goal), reason);
            }
            var plan = Plan.of(goal, generated != null ? generated : List.of());
            try {
                new PlanGraph(plan).validate();
            } catch (PlanStructureException e) {
                log.error("Rejected plan for goal {}: {}", goal.id(), e.getMessage());
                metrics.recordGoalResult("invalid");
                throw e;
            }

            eventBus.publish(EngineEvent.of("plan.created", goal.id(), null,
                    Map.of("planId", plan.id(), "taskCount", plan.tasks().size())));
            log.info("Plan {} created with {} tasks", plan.id(), plan.tasks().size());

            if (plan.tasks().isEmpty()) {
                log.warn("Plan generator returned no tasks for goal {}", goal.id());
                return failedBeforeExecution(goal, plan, "Plan generator returned no tasks");
            }
            if (autonomy.requiresApproval()) {
                log.info("Goal {} awaiting approval of plan {}", goal.id(), plan.id());
                metrics.recordGoalResult("awaiting_approval");
                return GoalResult.awaitingApproval(goal, plan);
            }

            try (var executor = executorFactory.create()) {
                return run(goal, plan, executor);
            }
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Requests cancellation of a running goal. The current wave finishes its in-flight
     * invocations; their results are marked cancelled and no further wave starts.
     *
     * @return true if the goal was running
     */
    public boolean cancel(String goalId) {
        var run = activeRuns.get(goalId);
        if (run == null) {
            return false;
        }
        run.cancelled = true;
        for (var taskId : run.wave) {
            run.executor.cancel(taskId);
        }
        log.info("Cancellation requested for goal {}", goalId);
        return true;
    }

    public boolean isRunning(String goalId) {
        return activeRuns.containsKey(goalId);
    }

    private GoalResult run(Goal goal, Plan plan, TaskExecutor executor) {
        var activeRun = new ActiveRun(executor);
        activeRuns.put(goal.id(), activeRun);
        try {
            return loop(goal, plan, executor, activeRun);
        } finally {
            activeRuns.remove(goal.id(), activeRun);
        }
    }

    private GoalResult loop(Goal goal, Plan plan, TaskExecutor executor, ActiveRun activeRun) {
        int maxReplans = properties.getOrchestrator().getMaxReplanningAttempts();
        int maxConcurrency = executorFactory.maxConcurrentTasks();
        var results = new ArrayList<TaskResult>();
        var superseded = new ArrayList<TaskResult>();
        int replanningAttempts = 0;
        int waves = 0;
        boolean stuck = false;
        List<String> blocked = List.of();
        var graph = new PlanGraph(plan);
        ProgressListener listener = (event, data) -> {
            if (ProgressListener.STARTED.equals(event)) {
                eventBus.publish(EngineEvent.of("task.started", goal.id(), (String) data.get("taskId"), data));
            }
        };

        plan.markExecuting();

        while (true) {
            if (activeRun.cancelled) {
                cancelRemaining(plan);
                break;
            }

            var ready = graph.readyTasks();
            if (ready.isEmpty()) {
                if (!graph.allFinished()) {
                    stuck = true;
                    blocked = graph.blockedTaskIds();
                    log.warn("Plan {} is stuck; tasks that can never run: {}", plan.id(), blocked);
                }
                break;
            }

            waves++;
            MdcContext.setWave(goal.id(), waves);
            log.info("Wave {}: dispatching {} task(s) {}", waves, ready.size(),
                    ready.stream().map(Task::id).toList());
            metrics.recordWaveExecution(ready.size());

            var startedAt = Instant.now();
            for (var task : ready) {
                task.markRunning(startedAt);
            }
            activeRun.wave = ready.stream().map(Task::id).toList();
            if (activeRun.cancelled) {
                continue;
            }
            var waveResults = executor.runMany(ready, maxConcurrency, listener);

            var failed = new ArrayList<Task>();
            for (int i = 0; i < ready.size(); i++) {
                var task = ready.get(i);
                var result = waveResults.get(i);
                task.applyResult(result, startedAt, Instant.now());
                results.add(result);
                publishTaskOutcome(goal, task, result);
                if (task.status() == TaskStatus.FAILED) {
                    failed.add(task);
                }
            }

            if (activeRun.cancelled) {
                continue;
            }

            Task replanTrigger = null;
            Evaluation triggerEvaluation = null;
            for (var task : failed) {
                var evaluation = reflector.evaluateTask(task, lastResultFor(results, task.id()));
                eventBus.publish(EngineEvent.of("task.evaluated", goal.id(), task.id(), Map.of(
                        "success", evaluation.success(),
                        "shouldReplan", evaluation.shouldReplan(),
                        "issues", evaluation.issues())));
                if (replanTrigger == null && evaluation.shouldReplan()) {
                    replanTrigger = task;
                    triggerEvaluation = evaluation;
                }
            }

            if (replanTrigger == null) {
                continue;
            }
            if (replanningAttempts >= maxReplans) {
                log.info("Task {} failed but replanning attempts are exhausted ({}/{})",
                        replanTrigger.id(), replanningAttempts, maxReplans);
                continue;
            }

            replanningAttempts++;
            if (revise(goal, plan, executor, replanTrigger, triggerEvaluation, replanningAttempts, results, superseded)) {
                graph = new PlanGraph(plan);
                graph.validate();
            }
        }

        return finish(goal, plan, results, superseded, replanningAttempts, waves, stuck, blocked, activeRun.cancelled);
    }

    /**
     * Asks the planner for a revision and merges it into the plan.
     *
     * @return true if the plan changed
     */
    private boolean revise(Goal goal, Plan plan, TaskExecutor executor, Task failedTask, Evaluation evaluation,
                           int attempt, List<TaskResult> results, List<TaskResult> superseded) {
        var category = ErrorCategory.classify(failedTask.error());
        log.info("Requesting plan revision {} after {} failure of task {}", attempt, category.key(), failedTask.id());
        metrics.recordReplan(category.key());

        List<Task> revised;
        try {
            revised = planGenerator.revisePlan(plan, new FailureContext(failedTask.id(), failedTask.error(), evaluation, attempt));
        } catch (Exception e) {
            log.warn("Plan revision {} failed, keeping the failure of {}: {}", attempt, failedTask.id(), e.getMessage());
            return false;
        }
        if (revised == null || revised.isEmpty()) {
            log.warn("Plan revision {} returned no tasks, keeping the failure of {}", attempt, failedTask.id());
            return false;
        }

        var dropped = plan.applyRevision(revised, failedTask.id());
        Set<String> stale = new HashSet<>(dropped);
        for (var task : plan.tasks()) {
            if (task.status() == TaskStatus.PENDING) {
                stale.add(task.id());
                executor.clearMetrics(task.id());
            }
        }
        var iterator = results.iterator();
        while (iterator.hasNext()) {
            var result = iterator.next();
            if (stale.contains(result.taskId())) {
                superseded.add(result);
                iterator.remove();
            }
        }

        log.info("Plan {} revised to revision {}: {} tasks, dropped {}",
                plan.id(), plan.revision(), plan.tasks().size(), dropped);
        eventBus.publish(EngineEvent.of("plan.revised", goal.id(), failedTask.id(), Map.of(
                "planId", plan.id(),
                "revision", plan.revision(),
                "attempt", attempt,
                "taskCount", plan.tasks().size(),
                "droppedTaskIds", dropped)));
        return true;
    }

    private GoalResult finish(Goal goal, Plan plan, List<TaskResult> results, List<TaskResult> superseded,
                              int replanningAttempts, int waves, boolean stuck, List<String> blocked,
                              boolean cancelled) {
        boolean success = !cancelled && !stuck && plan.allTasksCompleted();
        plan.finish(cancelled ? PlanStatus.CANCELLED : success ? PlanStatus.COMPLETED : PlanStatus.FAILED);

        String failureReason = null;
        if (cancelled) {
            failureReason = "Goal cancelled";
        } else if (stuck) {
            failureReason = "Plan stuck: tasks " + blocked + " can never become ready";
        } else if (!success) {
            failureReason = describeFailures(plan);
        }

        var episode = Episode.of(plan, results, success);
        recordEpisode(goal, episode);

        var evaluation = reflector.evaluatePlan(plan, results);
        eventBus.publish(EngineEvent.of("plan.evaluated", goal.id(), null, Map.of(
                "planId", plan.id(),
                "success", evaluation.success(),
                "confidence", evaluation.confidence(),
                "issues", evaluation.issues())));

        var stats = ExecutionStats.of(plan.tasks());
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", plan.status().name());
        payload.put("success", success);
        payload.put("replanningAttempts", replanningAttempts);
        payload.put("waves", waves);
        if (failureReason != null) {
            payload.put("failureReason", failureReason);
        }
        eventBus.publish(EngineEvent.of(EventBus.GOAL_COMPLETED, goal.id(), null, payload));
        metrics.recordGoalResult(plan.status().name().toLowerCase(Locale.ROOT));

        log.info("Goal {} finished {}: {}/{} tasks completed, {} replan(s), {} wave(s)",
                goal.id(), plan.status(), stats.completedTasks(), stats.totalTasks(), replanningAttempts, waves);

        return new GoalResult(goal, plan, results, success, replanningAttempts, false, stuck, blocked,
                failureReason, evaluation, stats, superseded, episode.id(), waves);
    }

    private GoalResult failedBeforeExecution(Goal goal, Plan plan, String reason) {
        plan.finish(PlanStatus.FAILED);
        eventBus.publish(EngineEvent.of(EventBus.GOAL_COMPLETED, goal.id(), null, Map.of(
                "status", plan.status().name(),
                "success", false,
                "failureReason", reason)));
        metrics.recordGoalResult("failed");
        return new GoalResult(goal, plan, List.of(), false, 0, false, false, List.of(), reason,
                null, ExecutionStats.of(plan.tasks()), List.of(), null, 0);
    }

    private void recordEpisode(Goal goal, Episode episode) {
        try {
            episodeRecorder.recordEpisode(episode);
            eventBus.publish(EngineEvent.of("episode.recorded", goal.id(), null,
                    Map.of("episodeId", episode.id(), "success", episode.success())));
        } catch (Exception e) {
            log.warn("Episode recorder failed for goal {}: {}", goal.id(), e.getMessage());
        }
    }

    private void publishTaskOutcome(Goal goal, Task task, TaskResult result) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("capability", task.capability());
        payload.put("status", task.status().name());
        payload.put("durationMs", result.durationMs());
        if (!result.success()) {
            payload.put("error", result.error());
        }
        eventBus.publish(EngineEvent.of(result.success() ? "task.completed" : "task.failed",
                goal.id(), task.id(), payload));
    }

    private static void cancelRemaining(Plan plan) {
        for (var task : plan.tasks()) {
            if (!task.status().isTerminal()) {
                task.markCancelled("Goal cancelled");
            }
        }
    }

    private static TaskResult lastResultFor(List<TaskResult> results, String taskId) {
        for (int i = results.size() - 1; i >= 0; i--) {
            if (results.get(i).taskId().equals(taskId)) {
                return results.get(i);
            }
        }
        throw new IllegalStateException("No result recorded for task " + taskId);
    }

    private static String describeFailures(Plan plan) {
        var failed = plan.tasks().stream()
                .filter(t -> t.status() == TaskStatus.FAILED)
                .toList();
        if (failed.isEmpty()) {
            return "Not all tasks completed";
        }
        var first = failed.get(0);
        return failed.size() + " task(s) failed; first: " + first.id() + ": " + first.error();
    }

    private static final class ActiveRun {
        private final TaskExecutor executor;
        private volatile boolean cancelled;
        private volatile List<String> wave = List.of();

        private ActiveRun(TaskExecutor executor) {
            this.executor = executor;
        }
    }
}
