package com.agentloop.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for goal execution.
 */
@Service
public class EngineMetrics {

    private final MeterRegistry registry;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String capability, long ms, boolean success) {
        Timer.builder("agentloop.task.duration")
                .tag("capability", capability)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTimeout(String capability) {
        Counter.builder("agentloop.task.timeouts")
                .description("Capability invocations that exceeded their timeout")
                .tag("capability", capability)
                .register(registry)
                .increment();
    }

    public void recordRetry(String capability) {
        Counter.builder("agentloop.task.retries")
                .tag("capability", capability)
                .register(registry)
                .increment();
    }

    public void recordReplan(String errorCategory) {
        Counter.builder("agentloop.replans.total")
                .tag("category", errorCategory)
                .register(registry)
                .increment();
    }

    public void recordGoalResult(String status) {
        Counter.builder("agentloop.goals.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records the number of tasks dispatched in one wave.
     *
     * @param taskCount ready tasks in the wave
     */
    public void recordWaveExecution(int taskCount) {
        DistributionSummary.builder("agentloop.wave.size")
                .description("Number of tasks per wave")
                .register(registry)
                .record(taskCount);
    }
}
