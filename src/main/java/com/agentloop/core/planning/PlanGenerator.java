package com.agentloop.core.planning;

import com.agentloop.core.model.Goal;
import com.agentloop.core.model.Plan;
import com.agentloop.core.model.Task;

import java.util.List;

/**
 * Boundary to the external planner that turns goals into task lists and revises plans after
 * failures. The engine validates and owns whatever task list comes back.
 */
public interface PlanGenerator {

    /**
     * @return the generated tasks, or an empty list when the planner is unavailable
     */
    List<Task> generatePlan(Goal goal, List<String> availableCapabilities);

    /**
     * @return the revised task list; implementations return the plan's current tasks when the
     *         planner's answer cannot be used
     */
    List<Task> revisePlan(Plan plan, FailureContext failureContext);
}
