package com.agentloop.core.executor;

import com.agentloop.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-executor metric store. Created and discarded with its {@link TaskExecutor}; safe for
 * concurrent writes from worker threads.
 */
public class TaskMonitor {

    private static final Logger log = LoggerFactory.getLogger(TaskMonitor.class);

    private final ConcurrentHashMap<String, ExecutionMetrics> metrics = new ConcurrentHashMap<>();
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    public ExecutionMetrics startMonitoring(Task task) {
        var m = metrics.computeIfAbsent(task.id(), ExecutionMetrics::new);
        m.start();
        running.add(task.id());
        log.debug("Monitoring started for {}", task.id());
        return m;
    }

    public Optional<ExecutionMetrics> stopMonitoring(String taskId) {
        running.remove(taskId);
        var m = metrics.get(taskId);
        if (m != null) {
            m.end();
        }
        return Optional.ofNullable(m);
    }

    public void checkpoint(String taskId, String name, Map<String, Object> data) {
        var m = metrics.get(taskId);
        if (m == null) {
            log.debug("Checkpoint {} ignored: {} is not monitored", name, taskId);
            return;
        }
        m.checkpoint(name, data);
    }

    public boolean isRunning(String taskId) {
        return running.contains(taskId);
    }

    public Set<String> runningTaskIds() {
        return Set.copyOf(running);
    }

    public Optional<ExecutionMetrics> getMetrics(String taskId) {
        return Optional.ofNullable(metrics.get(taskId));
    }

    /** Snapshot of all metrics keyed by task id. */
    public Map<String, ExecutionMetrics> getAllMetrics() {
        return new LinkedHashMap<>(metrics);
    }

    public void clearMetrics(String taskId) {
        metrics.remove(taskId);
        running.remove(taskId);
    }

    public void clearAll() {
        metrics.clear();
        running.clear();
    }
}
