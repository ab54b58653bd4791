package com.agentloop.core.config;

import com.agentloop.core.capability.CapabilityInvoker;
import com.agentloop.core.capability.CapabilityRegistry;
import com.agentloop.core.memory.EpisodeRecorder;
import com.agentloop.core.memory.LoggingEpisodeRecorder;
import com.agentloop.core.planning.PlanGenerator;
import com.agentloop.core.planning.UnavailablePlanGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default beans for the engine's external boundaries. Applications replace any of them by
 * declaring their own bean of the same type.
 */
@Configuration
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public CapabilityInvoker capabilityInvoker() {
        return new CapabilityRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public PlanGenerator planGenerator() {
        return new UnavailablePlanGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public EpisodeRecorder episodeRecorder(ObjectMapper objectMapper) {
        return new LoggingEpisodeRecorder(objectMapper);
    }
}
