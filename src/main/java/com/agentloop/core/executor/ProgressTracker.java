package com.agentloop.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Per-executor record of task progress: the latest update and the full history per task,
 * plus listeners notified of every update.
 */
public class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final Map<String, List<ProgressUpdate>> history = new ConcurrentHashMap<>();
    private final List<Consumer<ProgressUpdate>> listeners = new CopyOnWriteArrayList<>();

    public ProgressUpdate update(String taskId, ProgressStatus status, double progressPercent,
                                 String message, Map<String, Object> details) {
        var update = new ProgressUpdate(taskId, status, progressPercent, message, details, null);
        history.computeIfAbsent(taskId, id -> new CopyOnWriteArrayList<>()).add(update);
        log.trace("Progress {} {} {}%", taskId, status, update.progressPercent());
        for (var listener : listeners) {
            try {
                listener.accept(update);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed for task {}: {}", taskId, e.getMessage());
            }
        }
        return update;
    }

    public ProgressUpdate update(String taskId, ProgressStatus status, double progressPercent) {
        return update(taskId, status, progressPercent, null, null);
    }

    public Optional<ProgressUpdate> getProgress(String taskId) {
        var updates = history.get(taskId);
        if (updates == null || updates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(updates.get(updates.size() - 1));
    }

    /** Updates for {@code taskId} in the order they were recorded. */
    public List<ProgressUpdate> getHistory(String taskId) {
        var updates = history.get(taskId);
        return updates == null ? List.of() : List.copyOf(new ArrayList<>(updates));
    }

    public void addListener(Consumer<ProgressUpdate> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<ProgressUpdate> listener) {
        listeners.remove(listener);
    }

    public void clear(String taskId) {
        history.remove(taskId);
    }

    public void clearAll() {
        history.clear();
    }
}
