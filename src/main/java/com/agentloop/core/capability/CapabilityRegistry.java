package com.agentloop.core.capability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory catalog of named capabilities. Thread-safe for concurrent registration and
 * invocation.
 */
public class CapabilityRegistry implements CapabilityInvoker {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final ConcurrentHashMap<String, Capability> capabilities = new ConcurrentHashMap<>();

    public CapabilityRegistry register(String name, Capability capability) {
        if (capabilities.put(name, capability) != null) {
            log.info("Replaced capability {}", name);
        } else {
            log.debug("Registered capability {}", name);
        }
        return this;
    }

    public boolean unregister(String name) {
        return capabilities.remove(name) != null;
    }

    public boolean contains(String name) {
        return capabilities.containsKey(name);
    }

    @Override
    public CapabilityOutcome invoke(String name, Map<String, Object> parameters) throws Exception {
        var capability = capabilities.get(name);
        if (capability == null) {
            return CapabilityOutcome.failed("Capability not found: " + name);
        }
        var outcome = capability.execute(parameters != null ? parameters : Map.of());
        return outcome != null ? outcome : CapabilityOutcome.ok(null);
    }

    @Override
    public List<String> capabilityNames() {
        var names = new ArrayList<>(capabilities.keySet());
        names.sort(null);
        return names;
    }
}
