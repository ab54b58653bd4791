package com.agentloop.core.executor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Timing and named checkpoints for one task. Written by worker threads and read by callers,
 * so every accessor synchronizes on the instance.
 */
public class ExecutionMetrics {

    public record Checkpoint(String name, Map<String, Object> data, Instant at) {
        public Checkpoint {
            data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }
    }

    private final String taskId;
    private final List<Checkpoint> checkpoints = new ArrayList<>();
    private Instant startTime;
    private Instant endTime;

    public ExecutionMetrics(String taskId) {
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }

    /** Marks the start. Later calls keep the first start so retries accumulate into one span. */
    public synchronized void start() {
        if (startTime == null) {
            startTime = Instant.now();
        }
        endTime = null;
    }

    public synchronized void end() {
        endTime = Instant.now();
    }

    public synchronized void checkpoint(String name, Map<String, Object> data) {
        checkpoints.add(new Checkpoint(name, data, Instant.now()));
    }

    public synchronized Instant startTime() {
        return startTime;
    }

    public synchronized Instant endTime() {
        return endTime;
    }

    /** Elapsed time between start and end; zero until both are set. */
    public synchronized Duration executionTime() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }

    public synchronized List<Checkpoint> checkpoints() {
        return List.copyOf(checkpoints);
    }

    public synchronized Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("taskId", taskId);
        map.put("startTime", startTime != null ? startTime.toString() : null);
        map.put("endTime", endTime != null ? endTime.toString() : null);
        map.put("executionTimeMs", executionTime().toMillis());
        var cps = new ArrayList<Map<String, Object>>();
        for (var cp : checkpoints) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("name", cp.name());
            entry.put("data", cp.data());
            entry.put("at", cp.at().toString());
            cps.add(entry);
        }
        map.put("checkpoints", cps);
        return map;
    }
}
