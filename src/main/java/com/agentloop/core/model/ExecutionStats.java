package com.agentloop.core.model;

import java.time.Duration;
import java.util.List;

/**
 * Aggregate counters over the tasks of a plan.
 */
public record ExecutionStats(
    int totalTasks,
    int completedTasks,
    int failedTasks,
    int cancelledTasks,
    int runningTasks,
    int pendingTasks,
    double successRate,
    long averageDurationMs
) {

    public static ExecutionStats of(List<Task> tasks) {
        int completed = 0, failed = 0, cancelled = 0, running = 0, pending = 0;
        long totalDuration = 0;
        int timed = 0;
        for (var task : tasks) {
            switch (task.status()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case CANCELLED -> cancelled++;
                case RUNNING -> running++;
                case PENDING -> pending++;
            }
            if (task.startedAt() != null && task.completedAt() != null) {
                totalDuration += Duration.between(task.startedAt(), task.completedAt()).toMillis();
                timed++;
            }
        }
        int total = tasks.size();
        double rate = total == 0 ? 0.0 : (double) completed / total;
        long average = timed == 0 ? 0L : totalDuration / timed;
        return new ExecutionStats(total, completed, failed, cancelled, running, pending, rate, average);
    }
}
