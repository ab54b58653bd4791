package com.agentloop.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing agentloop MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setGoal(String goalId) {
        MDC.put("goalId", goalId);
    }

    public static void setTask(String goalId, String taskId, String capability) {
        if (goalId != null) {
            MDC.put("goalId", goalId);
        }
        MDC.put("taskId", taskId);
        MDC.put("capability", capability);
    }

    public static void setWave(String goalId, int waveNumber) {
        MDC.put("goalId", goalId);
        MDC.put("waveNumber", String.valueOf(waveNumber));
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("capability");
    }

    public static void clear() {
        MDC.remove("goalId");
        MDC.remove("taskId");
        MDC.remove("capability");
        MDC.remove("waveNumber");
    }
}
