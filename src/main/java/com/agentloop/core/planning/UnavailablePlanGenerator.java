package com.agentloop.core.planning;

import com.agentloop.core.model.Goal;
import com.agentloop.core.model.Plan;
import com.agentloop.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fallback used when no planner backend is configured: generates empty plans and leaves plans
 * unchanged on revision.
 */
public class UnavailablePlanGenerator implements PlanGenerator {

    private static final Logger log = LoggerFactory.getLogger(UnavailablePlanGenerator.class);

    @Override
    public List<Task> generatePlan(Goal goal, List<String> availableCapabilities) {
        log.warn("No plan generator configured; goal {} gets an empty plan", goal.id());
        return List.of();
    }

    @Override
    public List<Task> revisePlan(Plan plan, FailureContext failureContext) {
        log.warn("No plan generator configured; plan {} is left unchanged", plan.id());
        return plan.tasks();
    }
}
