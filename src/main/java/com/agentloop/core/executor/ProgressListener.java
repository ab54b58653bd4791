package com.agentloop.core.executor;

import java.util.Map;

/**
 * Callback for task transitions observed by the {@link TaskExecutor}. Exceptions thrown by a
 * listener are logged and ignored.
 */
@FunctionalInterface
public interface ProgressListener {

    String STARTED = "started";
    String COMPLETED = "completed";
    String FAILED = "failed";
    String TIMEOUT = "timeout";
    String CANCELLED = "cancelled";

    ProgressListener NONE = (event, data) -> { };

    /**
     * @param event one of {@link #STARTED}, {@link #COMPLETED}, {@link #FAILED}, {@link #TIMEOUT},
     *              {@link #CANCELLED}
     * @param data  at least {@code taskId} and {@code capability}
     */
    void onProgress(String event, Map<String, Object> data);
}
