package com.agentloop.core.executor;

import com.agentloop.core.capability.CapabilityInvoker;
import com.agentloop.core.config.AgentloopProperties;
import com.agentloop.core.metrics.EngineMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Creates one {@link TaskExecutor} per goal run from the configured executor settings.
 */
@Component
public class TaskExecutorFactory {

    private final CapabilityInvoker invoker;
    private final AgentloopProperties properties;
    private final EngineMetrics metrics;

    @Autowired
    public TaskExecutorFactory(CapabilityInvoker invoker, AgentloopProperties properties,
                               @Autowired(required = false) EngineMetrics metrics) {
        this.invoker = invoker;
        this.properties = properties;
        this.metrics = metrics;
    }

    public TaskExecutor create() {
        var executor = properties.getExecutor();
        var settings = new ExecutorSettings(
                executor.getMaxWorkers(),
                properties.getTaskTimeout(),
                executor.getMaxRetries(),
                properties.getRetryDelay(),
                properties.toResourceLimits());
        return new TaskExecutor(invoker, settings, metrics);
    }

    public int maxConcurrentTasks() {
        return Math.max(1, properties.getExecutor().getMaxConcurrentTasks());
    }
}
