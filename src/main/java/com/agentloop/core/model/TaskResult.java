package com.agentloop.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one executed attempt group of a task. Never mutated after creation;
 * annotated copies are produced with {@link #withMetadata(Map)}.
 *
 * @param taskId      task this result belongs to
 * @param success     whether the capability succeeded
 * @param output      opaque output payload (null on failure)
 * @param error       error text, set iff {@code success} is false
 * @param logs        ordered log lines collected while executing
 * @param durationMs  wall-clock execution time in milliseconds
 * @param metadata    retry counters, exhaustion flags, timeout and cancellation markers
 */
public record TaskResult(
    String taskId,
    boolean success,
    Object output,
    String error,
    List<String> logs,
    long durationMs,
    Map<String, Object> metadata
) {

    public static final String RETRIES = "retries";
    public static final String ATTEMPTS = "attempts";
    public static final String RETRY_EXHAUSTED = "retryExhausted";
    public static final String TIMED_OUT = "timedOut";
    public static final String CANCELLED = "cancelled";

    public TaskResult {
        if (success) {
            error = null;
        } else if (error == null || error.isBlank()) {
            error = "Unknown error";
        }
        logs = logs == null ? List.of() : List.copyOf(logs);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static TaskResult success(String taskId, Object output, long durationMs, List<String> logs) {
        return new TaskResult(taskId, true, output, null, logs, durationMs, Map.of());
    }

    public static TaskResult failure(String taskId, String error, long durationMs, List<String> logs) {
        return new TaskResult(taskId, false, null, error, logs, durationMs, Map.of());
    }

    public static TaskResult failure(String taskId, String error, long durationMs,
                                     List<String> logs, Map<String, Object> metadata) {
        return new TaskResult(taskId, false, null, error, logs, durationMs, metadata);
    }

    /** Copy with {@code extra} merged over the existing metadata. */
    public TaskResult withMetadata(Map<String, Object> extra) {
        var merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new TaskResult(taskId, success, output, error, logs, durationMs, merged);
    }

    public boolean timedOut() {
        return Boolean.TRUE.equals(metadata.get(TIMED_OUT));
    }

    public boolean cancelled() {
        return Boolean.TRUE.equals(metadata.get(CANCELLED));
    }

    public boolean retryExhausted() {
        return Boolean.TRUE.equals(metadata.get(RETRY_EXHAUSTED));
    }

    public double durationSeconds() {
        return durationMs / 1000.0;
    }
}
