package com.agentloop.core.executor;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One progress report for a task.
 *
 * @param taskId          task being reported on
 * @param status          stage reached
 * @param progressPercent completion estimate, clamped to 0..100
 * @param message         optional human-readable note
 * @param details         free-form data from the reporter
 * @param timestamp       when the update was recorded
 */
public record ProgressUpdate(
    String taskId,
    ProgressStatus status,
    double progressPercent,
    String message,
    Map<String, Object> details,
    Instant timestamp
) {

    public ProgressUpdate {
        progressPercent = Math.max(0.0, Math.min(100.0, progressPercent));
        message = message != null ? message : "";
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        timestamp = timestamp != null ? timestamp : Instant.now();
    }
}
