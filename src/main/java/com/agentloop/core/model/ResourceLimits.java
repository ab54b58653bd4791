package com.agentloop.core.model;

import java.util.Map;

/**
 * Resource ceilings for task execution. Only the timeout is enforced; memory and CPU
 * figures are advisory and reported through logging and telemetry.
 *
 * @param timeoutSeconds   per-task timeout
 * @param memoryLimitMb    advisory memory ceiling, or null
 * @param cpuLimitPercent  advisory CPU ceiling, or null
 */
public record ResourceLimits(
    double timeoutSeconds,
    Integer memoryLimitMb,
    Double cpuLimitPercent
) {

    public static final double DEFAULT_TIMEOUT_SECONDS = 30.0;

    public ResourceLimits {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
        }
    }

    public static ResourceLimits defaults() {
        return new ResourceLimits(DEFAULT_TIMEOUT_SECONDS, null, null);
    }

    /**
     * Builds limits from a loose config map ({@code timeout_seconds}, {@code memory_limit_mb},
     * {@code cpu_limit_percent}); missing keys fall back to defaults.
     */
    public static ResourceLimits fromMap(Map<String, ?> config) {
        double timeout = config.get("timeout_seconds") instanceof Number n
                ? n.doubleValue() : DEFAULT_TIMEOUT_SECONDS;
        Integer memory = config.get("memory_limit_mb") instanceof Number n ? n.intValue() : null;
        Double cpu = config.get("cpu_limit_percent") instanceof Number n ? n.doubleValue() : null;
        return new ResourceLimits(timeout, memory, cpu);
    }

    public boolean hasAdvisoryLimits() {
        return memoryLimitMb != null || cpuLimitPercent != null;
    }
}
