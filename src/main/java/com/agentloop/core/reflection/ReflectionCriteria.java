package com.agentloop.core.reflection;

import java.util.Map;

/**
 * Thresholds applied by the {@link Reflector}.
 *
 * @param minSuccessRate              minimum fraction of plan tasks that must succeed
 * @param maxExecutionTimeMultiplier  a task slower than expected time times this factor is flagged
 * @param requireAllTasksComplete     whether any incomplete task fails the plan
 * @param checkOutputQuality          whether empty outputs are reported
 */
public record ReflectionCriteria(
    double minSuccessRate,
    double maxExecutionTimeMultiplier,
    boolean requireAllTasksComplete,
    boolean checkOutputQuality
) {

    public static final double DEFAULT_MIN_SUCCESS_RATE = 0.8;
    public static final double DEFAULT_MAX_EXECUTION_TIME_MULTIPLIER = 2.0;

    public ReflectionCriteria {
        if (minSuccessRate < 0.0 || minSuccessRate > 1.0) {
            throw new IllegalArgumentException("minSuccessRate must be within [0, 1]: " + minSuccessRate);
        }
        if (maxExecutionTimeMultiplier <= 0.0) {
            throw new IllegalArgumentException(
                    "maxExecutionTimeMultiplier must be positive: " + maxExecutionTimeMultiplier);
        }
    }

    public static ReflectionCriteria defaults() {
        return new ReflectionCriteria(DEFAULT_MIN_SUCCESS_RATE, DEFAULT_MAX_EXECUTION_TIME_MULTIPLIER, true, true);
    }

    /**
     * Builds criteria from a loose config map using snake_case keys; missing keys keep
     * their defaults.
     */
    public static ReflectionCriteria fromMap(Map<String, ?> config) {
        double minRate = config.get("min_success_rate") instanceof Number n
                ? n.doubleValue() : DEFAULT_MIN_SUCCESS_RATE;
        double multiplier = config.get("max_execution_time_multiplier") instanceof Number n
                ? n.doubleValue() : DEFAULT_MAX_EXECUTION_TIME_MULTIPLIER;
        boolean requireAll = !(config.get("require_all_tasks_complete") instanceof Boolean b) || b;
        boolean checkOutput = !(config.get("check_output_quality") instanceof Boolean b) || b;
        return new ReflectionCriteria(minRate, multiplier, requireAll, checkOutput);
    }
}
