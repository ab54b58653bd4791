package com.agentloop.core.model;

/**
 * Trust level that decides whether a generated plan runs automatically.
 */
public enum AutonomyLevel {
    /** Every plan is returned for manual approval; no task runs. */
    PARANOID,
    BALANCED,
    AUTONOMOUS;

    public boolean requiresApproval() {
        return this == PARANOID;
    }
}
