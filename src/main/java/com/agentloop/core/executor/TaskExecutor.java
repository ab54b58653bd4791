package com.agentloop.core.executor;

import com.agentloop.core.capability.CapabilityInvoker;
import com.agentloop.core.capability.CapabilityOutcome;
import com.agentloop.core.logging.MdcContext;
import com.agentloop.core.metrics.EngineMetrics;
import com.agentloop.core.model.Task;
import com.agentloop.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs tasks by invoking their capability on a worker pool.
 * <p>
 * Every failure mode (capability error, thrown exception, timeout, cancellation, rejected
 * submission) is converted into a failed {@link TaskResult}; nothing escapes to the caller.
 * A timed-out invocation is abandoned, not interrupted, and may keep running in the
 * background until it returns.
 * <p>
 * Calls are handed straight to a worker and never queue: the pool keeps
 * {@link ExecutorSettings#maxWorkers()} threads warm and grows past that when calls overlap
 * or hang. Wave concurrency is bounded by {@link #runMany}, and the timeout clock starts when
 * the worker begins the call.
 * <p>
 * One executor serves one goal run and is closed when that run ends.
 */
public class TaskExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final CapabilityInvoker invoker;
    private final ExecutorSettings settings;
    private final EngineMetrics metrics;
    private final TaskMonitor monitor = new TaskMonitor();
    private final ProgressTracker progress = new ProgressTracker();
    private final PerformanceMonitor performance = new PerformanceMonitor();
    private final ExecutorService workerPool;
    private final ExecutorService dispatchPool;
    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean shutdown = new AtomicBoolean();

    public TaskExecutor(CapabilityInvoker invoker, ExecutorSettings settings, EngineMetrics metrics) {
        this.invoker = invoker;
        this.settings = settings;
        this.metrics = metrics;
        this.workerPool = new ThreadPoolExecutor(settings.maxWorkers(), Integer.MAX_VALUE,
                60L, TimeUnit.SECONDS, new SynchronousQueue<>(), namedDaemon("capability-worker"));
        this.dispatchPool = Executors.newCachedThreadPool(namedDaemon("wave-dispatch"));

        var limits = settings.limits();
        if (limits.hasAdvisoryLimits()) {
            log.info("Advisory limits (not enforced): memory={}MB cpu={}%",
                    limits.memoryLimitMb(), limits.cpuLimitPercent());
        }
    }

    TaskExecutor(CapabilityInvoker invoker, int maxWorkers, Duration defaultTimeout) {
        this(invoker, ExecutorSettings.of(maxWorkers, defaultTimeout), null);
    }

    /**
     * Runs one task once, using the default timeout when {@code timeout} is null.
     */
    public TaskResult runOne(Task task, Duration timeout, ProgressListener listener) {
        Duration effective = timeout != null ? timeout : settings.defaultTimeout();
        var logs = new ArrayList<String>();

        if (shutdown.get()) {
            return TaskResult.failure(task.id(), "Executor is shut down", 0, logs);
        }
        if (cancelled.contains(task.id())) {
            logs.add("Cancelled before execution");
            progress.update(task.id(), ProgressStatus.CANCELLED, 0, "Cancelled before execution", null);
            notifySafely(listener, ProgressListener.CANCELLED, task, Map.of());
            return TaskResult.failure(task.id(), "Task cancelled before execution", 0, logs,
                    Map.of(TaskResult.CANCELLED, true));
        }

        monitor.startMonitoring(task);
        progress.update(task.id(), ProgressStatus.STARTING, 0, "Invoking " + task.capability(), null);
        notifySafely(listener, ProgressListener.STARTED, task, Map.of());
        logs.add("Invoking capability " + task.capability());

        TaskResult result = invoke(task, effective, logs, listener);

        if (cancelled.contains(task.id()) && !result.cancelled()) {
            logs.add("Cancelled during execution");
            result = TaskResult.failure(task.id(), "Task cancelled", result.durationMs(), logs,
                    Map.of(TaskResult.CANCELLED, true));
        }

        monitor.stopMonitoring(task.id());
        performance.recordMetric(task.id(), PerformanceMonitor.EXECUTION_TIME, result.durationMs(), "ms");
        if (result.success()) {
            progress.update(task.id(), ProgressStatus.COMPLETED, 100, null, null);
        } else {
            progress.update(task.id(), result.cancelled() ? ProgressStatus.CANCELLED : ProgressStatus.FAILED,
                    progress.getProgress(task.id()).map(ProgressUpdate::progressPercent).orElse(0.0),
                    result.error(), null);
        }
        if (metrics != null) {
            metrics.recordTaskExecution(task.capability(), result.durationMs(), result.success());
        }

        if (result.success()) {
            log.debug("Task {} completed in {}ms", task.id(), result.durationMs());
            notifySafely(listener, ProgressListener.COMPLETED, task, Map.of("durationMs", result.durationMs()));
        } else {
            log.info("Task {} failed: {}", task.id(), result.error());
            notifySafely(listener, ProgressListener.FAILED, task,
                    Map.of("durationMs", result.durationMs(), "error", result.error()));
        }
        return result;
    }

    private TaskResult invoke(Task task, Duration timeout, List<String> logs, ProgressListener listener) {
        var started = new CountDownLatch(1);
        var startNs = new AtomicLong();
        Future<CapabilityOutcome> future;
        try {
            future = workerPool.submit(() -> {
                startNs.set(System.nanoTime());
                started.countDown();
                return invoker.invoke(task.capability(), task.parameters());
            });
        } catch (RejectedExecutionException e) {
            return TaskResult.failure(task.id(), "Executor rejected task: " + e.getMessage(), 0, logs);
        }

        try {
            started.await();
            CapabilityOutcome outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            long elapsed = elapsedMs(startNs.get());
            monitor.checkpoint(task.id(), "invoked", Map.of("elapsedMs", elapsed));
            if (outcome == null || outcome.success()) {
                logs.add("Capability returned successfully");
                return TaskResult.success(task.id(), outcome != null ? outcome.output() : null, elapsed, logs);
            }
            logs.add("Capability reported failure");
            return TaskResult.failure(task.id(), outcome.error(), elapsed, logs);
        } catch (TimeoutException e) {
            future.cancel(false);
            long elapsed = elapsedMs(startNs.get());
            String message = "Task execution timeout after " + formatSeconds(timeout);
            logs.add(message);
            log.warn("Task {} [{}] timed out after {}", task.id(), task.capability(), formatSeconds(timeout));
            if (metrics != null) {
                metrics.recordTimeout(task.capability());
            }
            notifySafely(listener, ProgressListener.TIMEOUT, task, Map.of("timeoutMs", timeout.toMillis()));
            return TaskResult.failure(task.id(), message, elapsed, logs, Map.of(TaskResult.TIMED_OUT, true));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            logs.add("Capability raised " + cause.getClass().getSimpleName() + ": " + message);
            log.debug("Capability {} raised for task {}", task.capability(), task.id(), cause);
            return TaskResult.failure(task.id(), message, elapsedMs(startNs.get()), logs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            long elapsed = started.getCount() == 0 ? elapsedMs(startNs.get()) : 0;
            return TaskResult.failure(task.id(), "Interrupted while waiting for capability", elapsed, logs);
        }
    }

    /**
     * Runs one task up to {@code maxRetries + 1} times, sleeping {@code retryDelay} between
     * attempts. The returned result carries {@link TaskResult#ATTEMPTS} and
     * {@link TaskResult#RETRIES}; when every attempt failed it also carries
     * {@link TaskResult#RETRY_EXHAUSTED}.
     */
    public TaskResult runWithRetry(Task task, int maxRetries, Duration retryDelay, ProgressListener listener) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        TaskResult last = null;
        int attempts = 0;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                monitor.checkpoint(task.id(), "retry", Map.of("attempt", attempt));
                if (metrics != null) {
                    metrics.recordRetry(task.capability());
                }
                log.info("Retrying task {} (attempt {}/{})", task.id(), attempt + 1, maxRetries + 1);
                if (!sleep(retryDelay)) {
                    return last.withMetadata(Map.of(TaskResult.ATTEMPTS, attempts, TaskResult.RETRIES, attempts - 1));
                }
            }
            last = runOne(task, null, listener);
            attempts++;
            if (last.success() || last.cancelled()) {
                return last.withMetadata(Map.of(TaskResult.ATTEMPTS, attempts, TaskResult.RETRIES, attempt));
            }
        }
        log.warn("Task {} failed after {} attempts", task.id(), attempts);
        return last.withMetadata(Map.of(
                TaskResult.ATTEMPTS, attempts,
                TaskResult.RETRIES, maxRetries,
                TaskResult.RETRY_EXHAUSTED, true));
    }

    /**
     * Runs all {@code tasks} with at most {@code maxConcurrency} in flight and returns one
     * result per task in input order. Uses the configured retry policy.
     */
    public List<TaskResult> runMany(List<Task> tasks, int maxConcurrency, ProgressListener listener) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        if (shutdown.get()) {
            return tasks.stream()
                    .map(t -> TaskResult.failure(t.id(), "Executor is shut down", 0, List.of()))
                    .toList();
        }
        var semaphore = new Semaphore(Math.max(1, maxConcurrency));
        Map<String, String> callerMdc = MDC.getCopyOfContextMap();
        var futures = new ArrayList<CompletableFuture<TaskResult>>(tasks.size());

        for (var task : tasks) {
            futures.add(dispatch(task, semaphore, callerMdc, listener));
        }

        var results = new ArrayList<TaskResult>(tasks.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException | CancellationException e) {
                log.error("Unexpected error collecting result for {}", tasks.get(i).id(), e);
                results.add(TaskResult.failure(tasks.get(i).id(), String.valueOf(e.getMessage()), 0, List.of()));
            }
        }
        return results;
    }

    private CompletableFuture<TaskResult> dispatch(Task task, Semaphore semaphore,
                                                   Map<String, String> callerMdc, ProgressListener listener) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                if (callerMdc != null) {
                    MDC.setContextMap(callerMdc);
                }
                MdcContext.setTask(null, task.id(), task.capability());
                try {
                    semaphore.acquire();
                    try {
                        return runWithPolicy(task, listener);
                    } finally {
                        semaphore.release();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return TaskResult.failure(task.id(), "Interrupted before dispatch", 0, List.of());
                } catch (RuntimeException e) {
                    log.error("Unexpected error running task {}: {}", task.id(), e.getMessage(), e);
                    return TaskResult.failure(task.id(), String.valueOf(e.getMessage()), 0, List.of());
                } finally {
                    MDC.clear();
                }
            }, dispatchPool);
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch of task {} rejected: {}", task.id(), e.getMessage());
            return CompletableFuture.completedFuture(
                    TaskResult.failure(task.id(), "Executor rejected task: " + e.getMessage(), 0, List.of()));
        }
    }

    private TaskResult runWithPolicy(Task task, ProgressListener listener) {
        if (settings.maxRetries() > 0) {
            return runWithRetry(task, settings.maxRetries(), settings.retryDelay(), listener);
        }
        return runOne(task, null, listener);
    }

    /** Marks a task cancelled; takes effect at its next start or completion boundary. */
    public boolean cancel(String taskId) {
        boolean added = cancelled.add(taskId);
        if (added) {
            log.info("Cancellation requested for task {}", taskId);
        }
        return added;
    }

    public boolean isCancelled(String taskId) {
        return cancelled.contains(taskId);
    }

    public Set<String> runningTaskIds() {
        return monitor.runningTaskIds();
    }

    public void checkpoint(String taskId, String name, Map<String, Object> data) {
        monitor.checkpoint(taskId, name, data);
    }

    /**
     * Reports intermediate progress for a running task, typically from inside its capability.
     */
    public ProgressUpdate reportProgress(String taskId, double percent, String message) {
        return progress.update(taskId, ProgressStatus.IN_PROGRESS, percent, message, null);
    }

    public void recordMetric(String taskId, String metricName, double value, String unit) {
        performance.recordMetric(taskId, metricName, value, unit);
    }

    /** Drops timing, progress and performance data for one task. */
    public void clearMetrics(String taskId) {
        monitor.clearMetrics(taskId);
        progress.clear(taskId);
        performance.clearMetrics(taskId);
    }

    public TaskMonitor monitor() {
        return monitor;
    }

    public ProgressTracker progress() {
        return progress;
    }

    public PerformanceMonitor performance() {
        return performance;
    }

    public ExecutorSettings settings() {
        return settings;
    }

    /**
     * Stops accepting work. With {@code waitForRunning}, blocks up to the default timeout for
     * in-flight invocations; running capabilities are never interrupted.
     */
    public void shutdown(boolean waitForRunning) {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        dispatchPool.shutdown();
        workerPool.shutdown();
        if (!waitForRunning) {
            return;
        }
        try {
            long waitMs = settings.defaultTimeout().toMillis();
            if (!workerPool.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                log.warn("Capability workers still running after {}ms: {}", waitMs, monitor.runningTaskIds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    @Override
    public void close() {
        shutdown(true);
    }

    private void notifySafely(ProgressListener listener, String event, Task task, Map<String, Object> extra) {
        if (listener == null) {
            return;
        }
        var data = new LinkedHashMap<String, Object>();
        data.put("taskId", task.id());
        data.put("capability", task.capability());
        data.putAll(extra);
        try {
            listener.onProgress(event, data);
        } catch (Exception e) {
            log.warn("Progress listener threw on {} for task {}: {}", event, task.id(), e.getMessage());
        }
    }

    private static boolean sleep(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static long elapsedMs(long startNs) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
    }

    private static String formatSeconds(Duration d) {
        double seconds = d.toMillis() / 1000.0;
        return (seconds == Math.rint(seconds) ? String.valueOf((long) seconds) : String.valueOf(seconds)) + "s";
    }

    private static ThreadFactory namedDaemon(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
