package com.agentloop.core.config;

import com.agentloop.core.model.AutonomyLevel;
import com.agentloop.core.model.ResourceLimits;
import com.agentloop.core.reflection.ReflectionCriteria;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "agentloop")
public class AgentloopProperties {

    private Executor executor = new Executor();
    private Orchestrator orchestrator = new Orchestrator();
    private Reflection reflection = new Reflection();
    private Limits limits = new Limits();

    // -- Derived views --
    public Duration getTaskTimeout() { return Duration.ofSeconds(executor.taskTimeoutSeconds); }
    public Duration getRetryDelay() { return Duration.ofMillis(executor.retryDelayMs); }

    public ReflectionCriteria toReflectionCriteria() {
        return new ReflectionCriteria(reflection.minSuccessRate, reflection.maxExecutionTimeMultiplier,
                reflection.requireAllTasksComplete, reflection.checkOutputQuality);
    }

    public ResourceLimits toResourceLimits() {
        return new ResourceLimits(executor.taskTimeoutSeconds, limits.memoryLimitMb, limits.cpuLimitPercent);
    }

    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }
    public Reflection getReflection() { return reflection; }
    public void setReflection(Reflection reflection) { this.reflection = reflection; }
    public Limits getLimits() { return limits; }
    public void setLimits(Limits limits) { this.limits = limits; }

    public static class Executor {
        private int taskTimeoutSeconds = 30;
        private int maxWorkers = 4;
        private int maxConcurrentTasks = 4;
        private int maxRetries = 0;
        private long retryDelayMs = 1000;

        public int getTaskTimeoutSeconds() { return taskTimeoutSeconds; }
        public void setTaskTimeoutSeconds(int taskTimeoutSeconds) { this.taskTimeoutSeconds = taskTimeoutSeconds; }
        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }
        public int getMaxConcurrentTasks() { return maxConcurrentTasks; }
        public void setMaxConcurrentTasks(int maxConcurrentTasks) { this.maxConcurrentTasks = maxConcurrentTasks; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getRetryDelayMs() { return retryDelayMs; }
        public void setRetryDelayMs(long retryDelayMs) { this.retryDelayMs = retryDelayMs; }
    }

    public static class Orchestrator {
        private int maxReplanningAttempts = 3;
        private AutonomyLevel autonomy = AutonomyLevel.BALANCED;

        public int getMaxReplanningAttempts() { return maxReplanningAttempts; }
        public void setMaxReplanningAttempts(int maxReplanningAttempts) { this.maxReplanningAttempts = maxReplanningAttempts; }
        public AutonomyLevel getAutonomy() { return autonomy; }
        public void setAutonomy(AutonomyLevel autonomy) { this.autonomy = autonomy; }
    }

    public static class Reflection {
        private double minSuccessRate = ReflectionCriteria.DEFAULT_MIN_SUCCESS_RATE;
        private double maxExecutionTimeMultiplier = ReflectionCriteria.DEFAULT_MAX_EXECUTION_TIME_MULTIPLIER;
        private boolean requireAllTasksComplete = true;
        private boolean checkOutputQuality = true;

        public double getMinSuccessRate() { return minSuccessRate; }
        public void setMinSuccessRate(double minSuccessRate) { this.minSuccessRate = minSuccessRate; }
        public double getMaxExecutionTimeMultiplier() { return maxExecutionTimeMultiplier; }
        public void setMaxExecutionTimeMultiplier(double maxExecutionTimeMultiplier) { this.maxExecutionTimeMultiplier = maxExecutionTimeMultiplier; }
        public boolean isRequireAllTasksComplete() { return requireAllTasksComplete; }
        public void setRequireAllTasksComplete(boolean requireAllTasksComplete) { this.requireAllTasksComplete = requireAllTasksComplete; }
        public boolean isCheckOutputQuality() { return checkOutputQuality; }
        public void setCheckOutputQuality(boolean checkOutputQuality) { this.checkOutputQuality = checkOutputQuality; }
    }

    /** Advisory ceilings: logged with every executor, never enforced. */
    public static class Limits {
        private Integer memoryLimitMb;
        private Double cpuLimitPercent;

        public Integer getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(Integer memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public Double getCpuLimitPercent() { return cpuLimitPercent; }
        public void setCpuLimitPercent(Double cpuLimitPercent) { this.cpuLimitPercent = cpuLimitPercent; }
    }
}
