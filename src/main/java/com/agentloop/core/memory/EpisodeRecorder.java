package com.agentloop.core.memory;

import com.agentloop.core.model.Episode;

/**
 * Sink for finished goal runs. Failures are logged by the caller and never affect the
 * goal result.
 */
public interface EpisodeRecorder {

    void recordEpisode(Episode episode) throws Exception;
}
