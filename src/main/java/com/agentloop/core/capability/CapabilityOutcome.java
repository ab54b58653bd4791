package com.agentloop.core.capability;

/**
 * Value returned by a capability invocation: either an output or an error message.
 */
public record CapabilityOutcome(boolean success, Object output, String error) {

    public static CapabilityOutcome ok(Object output) {
        return new CapabilityOutcome(true, output, null);
    }

    public static CapabilityOutcome failed(String error) {
        return new CapabilityOutcome(false, null, error);
    }
}
