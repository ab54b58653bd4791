package com.agentloop.core.executor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-executor store of named numeric samples per task, such as execution time or memory
 * readings reported by capabilities.
 */
public class PerformanceMonitor {

    public static final String EXECUTION_TIME = "execution_time";

    public record Sample(double value, String unit, Instant recordedAt) {}

    public record Summary(double min, double max, double avg, int count) {}

    private final Map<String, Map<String, List<Sample>>> samples = new ConcurrentHashMap<>();

    public void recordMetric(String taskId, String metricName, double value, String unit) {
        samples.computeIfAbsent(taskId, id -> new ConcurrentHashMap<>())
                .computeIfAbsent(metricName, name -> new CopyOnWriteArrayList<>())
                .add(new Sample(value, unit != null ? unit : "", Instant.now()));
    }

    /** Samples per metric name for one task; empty when nothing was recorded. */
    public Map<String, List<Sample>> getMetrics(String taskId) {
        var byName = samples.get(taskId);
        if (byName == null) {
            return Map.of();
        }
        var copy = new LinkedHashMap<String, List<Sample>>();
        byName.forEach((name, values) -> copy.put(name, List.copyOf(new ArrayList<>(values))));
        return copy;
    }

    public Optional<Summary> getMetricSummary(String taskId, String metricName) {
        var values = getMetrics(taskId).get(metricName);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        var stats = values.stream().mapToDouble(Sample::value).summaryStatistics();
        return Optional.of(new Summary(stats.getMin(), stats.getMax(), stats.getAverage(), (int) stats.getCount()));
    }

    public void clearMetrics(String taskId) {
        samples.remove(taskId);
    }

    public void clearAll() {
        samples.clear();
    }
}
