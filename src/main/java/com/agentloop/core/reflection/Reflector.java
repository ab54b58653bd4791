package com.agentloop.core.reflection;

import com.agentloop.core.config.AgentloopProperties;
import com.agentloop.core.graph.PlanGraph;
import com.agentloop.core.model.Episode;
import com.agentloop.core.model.Evaluation;
import com.agentloop.core.model.Plan;
import com.agentloop.core.model.Task;
import com.agentloop.core.model.TaskResult;
import com.agentloop.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns raw task results into {@link Evaluation}s.
 * <p>
 * Task evaluation classifies the error text with {@link ErrorCategory} and flags slow or
 * empty results. Plan evaluation applies the success-rate and completeness thresholds of
 * {@link ReflectionCriteria} and reports recurring failures as {@link FailurePattern}s.
 * <p>
 * Every method is a function of its arguments and the configured criteria. Nothing is
 * mutated and no state is kept between calls.
 */
@Service
public class Reflector {

    private static final Logger log = LoggerFactory.getLogger(Reflector.class);

    private static final double FAILURE_CONFIDENCE = 0.3;
    private static final double SUCCESS_CONFIDENCE = 0.95;
    private static final double ISSUE_PENALTY = 0.15;
    private static final double MIN_SUCCESS_CONFIDENCE = 0.5;

    /** Fully sequential plans longer than this get a parallelization hint. */
    static final int LONG_CHAIN_THRESHOLD = 4;

    /** A task slower than this multiple of the median is a performance outlier. */
    static final double OUTLIER_FACTOR = 3.0;

    private final ReflectionCriteria criteria;

    @Autowired
    public Reflector(AgentloopProperties properties) {
        this(properties.toReflectionCriteria());
    }

    public Reflector(ReflectionCriteria criteria) {
        this.criteria = criteria != null ? criteria : ReflectionCriteria.defaults();
    }

    public ReflectionCriteria criteria() {
        return criteria;
    }

    /**
     * Evaluates one task result. {@code success} mirrors the result; slowness and empty
     * output only add issues.
     */
    public Evaluation evaluateTask(Task task, TaskResult result) {
        var issues = new ArrayList<String>();
        var suggestions = new ArrayList<String>();
        boolean shouldReplan = false;

        if (!result.success()) {
            var category = ErrorCategory.classify(result.error());
            issues.add("Task failed: " + result.error());
            issues.add(category.issue() + " (" + category.key() + ")");
            suggestions.add(category.suggestion());
            if (result.retryExhausted()) {
                issues.add("All retries exhausted after " + result.metadata().get(TaskResult.ATTEMPTS) + " attempts");
            }
            shouldReplan = category.replanWorthwhile();
        }

        Double expected = task.expectedTimeSeconds();
        if (expected != null && expected > 0
                && result.durationSeconds() > expected * criteria.maxExecutionTimeMultiplier()) {
            issues.add(String.format(Locale.ROOT, "Task took %.1fs, expected %.1fs", result.durationSeconds(), expected));
            suggestions.add("Review the performance of " + task.capability() + " or raise the expected time");
        }

        if (result.success() && criteria.checkOutputQuality() && isEmpty(result.output())) {
            issues.add("Task produced empty output");
            suggestions.add("Verify that " + task.capability() + " returns a result for these parameters");
        }

        double confidence = result.success()
                ? Math.max(MIN_SUCCESS_CONFIDENCE, SUCCESS_CONFIDENCE - ISSUE_PENALTY * issues.size())
                : FAILURE_CONFIDENCE;

        log.debug("Evaluated task {}: success={} replan={} issues={}",
                task.id(), result.success(), shouldReplan, issues.size());
        return Evaluation.forTask(task.id(), result.success(), confidence, issues, suggestions, shouldReplan);
    }

    /**
     * Evaluates the plan as a whole. The success rate is computed over the plan's tasks; an
     * empty plan counts as fully successful.
     */
    public Evaluation evaluatePlan(Plan plan, List<TaskResult> results) {
        var tasks = plan.tasks();
        var latest = latestResults(results);
        int total = tasks.size();
        int successful = 0;
        var failedCategories = new LinkedHashSet<ErrorCategory>();
        for (var task : tasks) {
            if (succeeded(task, latest.get(task.id()))) {
                successful++;
            } else {
                String error = errorOf(task, latest.get(task.id()));
                if (error != null) {
                    failedCategories.add(ErrorCategory.classify(error));
                }
            }
        }
        int incomplete = total - successful;
        double rate = total == 0 ? 1.0 : (double) successful / total;

        var issues = new ArrayList<String>();
        var suggestions = new ArrayList<String>();

        if (rate < criteria.minSuccessRate()) {
            issues.add(String.format(Locale.ROOT, "Success rate %.0f%% is below the required %.0f%%",
                    rate * 100, criteria.minSuccessRate() * 100));
            suggestions.add("Revise the plan around the failed tasks");
        }
        if (criteria.requireAllTasksComplete() && incomplete > 0) {
            issues.add(incomplete + " of " + total + " tasks did not complete");
            suggestions.add("Complete or replace the unfinished tasks");
        }

        for (var pattern : detectFailurePatterns(plan, results)) {
            issues.add(pattern.description());
            suggestions.add(suggestionFor(pattern));
        }

        int chain = new PlanGraph(plan).longestChain();
        if (chain > LONG_CHAIN_THRESHOLD && chain == total) {
            issues.add("Plan is a sequential chain of " + chain + " tasks");
            suggestions.add("Consider parallelizing tasks that do not depend on each other");
        }

        boolean success = rate >= criteria.minSuccessRate()
                && (!criteria.requireAllTasksComplete() || incomplete == 0);
        boolean shouldReplan = !success && (rate < criteria.minSuccessRate()
                || failedCategories.stream().anyMatch(ErrorCategory::replanWorthwhile));

        log.info("Evaluated plan {}: {}/{} succeeded, success={} replan={}",
                plan.id(), successful, total, success, shouldReplan);
        return Evaluation.forPlan(plan.id(), success, rate, issues, suggestions, shouldReplan);
    }

    /**
     * Finds recurring failures: the same error category in two or more tasks, runs of two or
     * more consecutive failing tasks in declaration order, and the same capability failing
     * in two or more tasks.
     */
    public List<FailurePattern> detectFailurePatterns(Plan plan, List<TaskResult> results) {
        var latest = latestResults(results);
        var byCategory = new LinkedHashMap<ErrorCategory, List<String>>();
        var byCapability = new LinkedHashMap<String, List<String>>();
        var patterns = new ArrayList<FailurePattern>();
        var run = new ArrayList<String>();

        for (var task : plan.tasks()) {
            var result = latest.get(task.id());
            String error = errorOf(task, result);
            boolean failed = error != null && !succeeded(task, result);
            if (!failed) {
                addRun(patterns, run);
                run = new ArrayList<>();
                continue;
            }
            run.add(task.id());
            byCategory.computeIfAbsent(ErrorCategory.classify(error), k -> new ArrayList<>()).add(task.id());
            byCapability.computeIfAbsent(task.capability(), k -> new ArrayList<>()).add(task.id());
        }
        addRun(patterns, run);

        byCategory.forEach((category, ids) -> {
            if (ids.size() >= 2) {
                patterns.add(new FailurePattern(FailurePattern.REPEATED_ERRORS,
                        "Repeated " + category.key() + " errors in " + ids.size() + " tasks", ids.size(), ids));
            }
        });
        byCapability.forEach((capability, ids) -> {
            if (ids.size() >= 2) {
                patterns.add(new FailurePattern(FailurePattern.TOOL_FAILURE,
                        "Capability " + capability + " failed in " + ids.size() + " tasks", ids.size(), ids));
            }
        });
        return patterns;
    }

    private static void addRun(List<FailurePattern> patterns, List<String> run) {
        if (run.size() >= 2) {
            patterns.add(new FailurePattern(FailurePattern.SEQUENTIAL_FAILURES,
                    run.size() + " consecutive tasks failed starting at " + run.get(0), run.size(), run));
        }
    }

    /**
     * Derives insights from a finished episode: per-capability success rates, the error
     * categories behind failures, and tasks that ran much slower than the median.
     */
    public List<Insight> learnFromEpisode(Episode episode) {
        var insights = new ArrayList<Insight>();
        Map<String, Task> tasksById = new HashMap<>();
        for (var task : episode.plan().tasks()) {
            tasksById.put(task.id(), task);
        }

        var perCapability = new LinkedHashMap<String, int[]>();
        var perCategory = new LinkedHashMap<ErrorCategory, Integer>();
        for (var result : episode.results()) {
            var task = tasksById.get(result.taskId());
            String capability = task != null ? task.capability() : "unknown";
            int[] counts = perCapability.computeIfAbsent(capability, k -> new int[2]);
            counts[1]++;
            if (result.success()) {
                counts[0]++;
            } else {
                perCategory.merge(ErrorCategory.classify(result.error()), 1, Integer::sum);
            }
        }

        perCapability.forEach((capability, counts) -> {
            double rate = (double) counts[0] / counts[1];
            insights.add(new Insight(Insight.TOOL_EFFECTIVENESS,
                    String.format(Locale.ROOT, "Capability %s succeeded in %d of %d tasks (%.0f%%)",
                            capability, counts[0], counts[1], rate * 100),
                    Math.min(0.9, 0.5 + 0.1 * counts[1]),
                    Map.of("capability", capability, "successRate", rate, "samples", counts[1])));
        });

        perCategory.forEach((category, count) -> insights.add(new Insight(Insight.FAILURE_MODE,
                count + " task(s) failed with " + category.key() + " errors: " + category.suggestion(),
                Math.min(0.9, 0.5 + 0.1 * count),
                Map.of("category", category.key(), "occurrences", count))));

        insights.addAll(performanceOutliers(episode.results()));
        log.debug("Derived {} insights from episode {}", insights.size(), episode.id());
        return insights;
    }

    private static List<Insight> performanceOutliers(List<TaskResult> results) {
        if (results.size() < 2) {
            return List.of();
        }
        var durations = results.stream().mapToLong(TaskResult::durationMs).sorted().toArray();
        int mid = durations.length / 2;
        double median = durations.length % 2 == 1
                ? durations[mid]
                : (durations[mid - 1] + durations[mid]) / 2.0;
        if (median <= 0) {
            return List.of();
        }
        var outliers = new ArrayList<Insight>();
        for (var result : results) {
            if (result.durationMs() > median * OUTLIER_FACTOR) {
                outliers.add(new Insight(Insight.PERFORMANCE,
                        String.format(Locale.ROOT, "Task %s took %.1fs, over %.0fx the median of %.1fs",
                                result.taskId(), result.durationSeconds(), OUTLIER_FACTOR, median / 1000.0),
                        0.7,
                        Map.of("taskId", result.taskId(), "durationMs", result.durationMs(), "medianMs", median)));
            }
        }
        return outliers;
    }

    private static String suggestionFor(FailurePattern pattern) {
        return switch (pattern.patternType()) {
            case FailurePattern.SEQUENTIAL_FAILURES -> "Failures cascade along dependencies; fix the first failing task";
            case FailurePattern.TOOL_FAILURE -> "Check the capability itself or switch to an alternative";
            default -> "Address the shared root cause before retrying";
        };
    }

    private static Map<String, TaskResult> latestResults(List<TaskResult> results) {
        var latest = new HashMap<String, TaskResult>();
        for (var result : results) {
            latest.put(result.taskId(), result);
        }
        return latest;
    }

    private static boolean succeeded(Task task, TaskResult result) {
        return result != null ? result.success() : task.status() == TaskStatus.COMPLETED;
    }

    /** Error text from the latest result, or from the task when it failed without one. */
    private static String errorOf(Task task, TaskResult result) {
        if (result != null) {
            return result.success() ? null : result.error();
        }
        if (task.status() == TaskStatus.FAILED || task.status() == TaskStatus.CANCELLED) {
            return task.error() != null ? task.error() : "Unknown error";
        }
        return null;
    }

    private static boolean isEmpty(Object output) {
        if (output == null) {
            return true;
        }
        if (output instanceof CharSequence text) {
            return text.toString().isBlank();
        }
        if (output instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (output instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }
}
