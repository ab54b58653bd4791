package com.agentloop.core.executor;

import com.agentloop.core.model.ResourceLimits;

import java.time.Duration;

/**
 * Sizing and default policies for one {@link TaskExecutor}.
 *
 * @param maxWorkers     capability worker threads kept alive between calls
 * @param defaultTimeout timeout used when a call does not pass one
 * @param maxRetries     retries per task when running a wave
 * @param retryDelay     delay between retry attempts
 * @param limits         resource ceilings; only the timeout is enforced
 */
public record ExecutorSettings(
    int maxWorkers,
    Duration defaultTimeout,
    int maxRetries,
    Duration retryDelay,
    ResourceLimits limits
) {

    public ExecutorSettings {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1: " + maxWorkers);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            defaultTimeout = Duration.ofMillis((long) (ResourceLimits.DEFAULT_TIMEOUT_SECONDS * 1000));
        }
        retryDelay = retryDelay == null || retryDelay.isNegative() ? Duration.ZERO : retryDelay;
        limits = limits == null ? ResourceLimits.defaults() : limits;
    }

    public static ExecutorSettings of(int maxWorkers, Duration defaultTimeout) {
        return new ExecutorSettings(maxWorkers, defaultTimeout, 0, Duration.ZERO, null);
    }
}
