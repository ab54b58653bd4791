package com.agentloop.core.model;

/**
 * Lifecycle status of a plan: DRAFT, then EXECUTING once the autonomy gate lets it through,
 * ending in one of the three terminal states.
 */
public enum PlanStatus {
    DRAFT,
    EXECUTING,
    COMPLETED,
    FAILED,
    CANCELLED
}
