package com.agentloop.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory fan-out of {@link EngineEvent}s to goal-scoped and global sinks.
 * <p>
 * Goal subscriptions live as long as the goal: once a {@link #GOAL_COMPLETED} event has been
 * delivered, the goal's subscribers are released, so the bus does not grow with every goal
 * ever run. Global subscribers stay until they unsubscribe. A sink that throws is logged and
 * skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Last event of every goal run. */
    public static final String GOAL_COMPLETED = "goal.completed";

    private final Map<String, List<Consumer<EngineEvent>>> goalSinks = new ConcurrentHashMap<>();
    private final List<Consumer<EngineEvent>> globalSinks = new CopyOnWriteArrayList<>();

    public void publish(EngineEvent event) {
        String goalId = event.goalId();
        log.debug("Event {} goal={} task={}", event.eventType(), goalId, event.taskId());

        if (goalId != null) {
            var sinks = goalSinks.get(goalId);
            if (sinks != null) {
                sinks.forEach(sink -> deliver(sink, event));
            }
        }
        globalSinks.forEach(sink -> deliver(sink, event));

        if (goalId != null && GOAL_COMPLETED.equals(event.eventType())) {
            var released = goalSinks.remove(goalId);
            if (released != null) {
                log.debug("Released {} subscriber(s) of finished goal {}", released.size(), goalId);
            }
        }
    }

    /**
     * Receives the events of one goal until it completes or the subscription is cancelled.
     */
    public Subscription subscribe(String goalId, Consumer<EngineEvent> sink) {
        goalSinks.computeIfAbsent(goalId, id -> new CopyOnWriteArrayList<>()).add(sink);
        return () -> goalSinks.computeIfPresent(goalId, (id, sinks) -> {
            sinks.remove(sink);
            return sinks.isEmpty() ? null : sinks;
        });
    }

    /**
     * Receives the events of every goal.
     */
    public Subscription subscribeAll(Consumer<EngineEvent> sink) {
        globalSinks.add(sink);
        return () -> globalSinks.remove(sink);
    }

    /** Number of live subscribers scoped to {@code goalId}. */
    public int subscriberCount(String goalId) {
        var sinks = goalSinks.get(goalId);
        return sinks == null ? 0 : sinks.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliver(Consumer<EngineEvent> sink, EngineEvent event) {
        try {
            sink.accept(event);
        } catch (RuntimeException e) {
            log.warn("Event sink failed on {} for goal {}: {}", event.eventType(), event.goalId(), e.getMessage(), e);
        }
    }
}
