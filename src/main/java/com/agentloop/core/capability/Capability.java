package com.agentloop.core.capability;

import java.util.Map;

/**
 * A single invocable capability registered in a {@link CapabilityRegistry}.
 */
@FunctionalInterface
public interface Capability {

    CapabilityOutcome execute(Map<String, Object> parameters) throws Exception;
}
