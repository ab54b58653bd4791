package com.agentloop.core.memory;

import com.agentloop.core.model.Episode;
import com.agentloop.core.model.ExecutionStats;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default {@link EpisodeRecorder}: writes a JSON summary of each episode to the log.
 */
public class LoggingEpisodeRecorder implements EpisodeRecorder {

    private static final Logger log = LoggerFactory.getLogger(LoggingEpisodeRecorder.class);

    private final ObjectMapper objectMapper;

    public LoggingEpisodeRecorder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void recordEpisode(Episode episode) throws JsonProcessingException {
        log.info("Episode recorded: {}", objectMapper.writeValueAsString(summarize(episode)));
    }

    Map<String, Object> summarize(Episode episode) {
        var plan = episode.plan();
        var stats = ExecutionStats.of(plan.tasks());

        var tasks = new ArrayList<Map<String, Object>>();
        for (var result : episode.results()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("taskId", result.taskId());
            entry.put("success", result.success());
            entry.put("durationMs", result.durationMs());
            if (!result.success()) {
                entry.put("error", result.error());
            }
            tasks.add(entry);
        }

        var summary = new LinkedHashMap<String, Object>();
        summary.put("episodeId", episode.id());
        summary.put("goalId", episode.goalId());
        summary.put("goal", plan.goal() != null ? plan.goal().description() : null);
        summary.put("planId", plan.id());
        summary.put("planStatus", plan.status().name());
        summary.put("revision", plan.revision());
        summary.put("success", episode.success());
        summary.put("createdAt", episode.createdAt().toString());
        summary.put("totalTasks", stats.totalTasks());
        summary.put("completedTasks", stats.completedTasks());
        summary.put("failedTasks", stats.failedTasks());
        summary.put("results", tasks);
        return summary;
    }
}
