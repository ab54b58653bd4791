package com.agentloop.core.capability;

import java.util.List;
import java.util.Map;

/**
 * Boundary to the external capability catalog. The engine calls it to run one task's
 * declared capability and never implements capabilities itself.
 * <p>
 * Implementations must tolerate concurrent calls from several worker threads.
 */
public interface CapabilityInvoker {

    /**
     * Invokes {@code name} with {@code parameters}. Implementations may report failure either
     * through {@link CapabilityOutcome#failed(String)} or by throwing.
     */
    CapabilityOutcome invoke(String name, Map<String, Object> parameters) throws Exception;

    /** Names of the capabilities that can be invoked; offered to the plan generator. */
    default List<String> capabilityNames() {
        return List.of();
    }
}
