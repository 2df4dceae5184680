package com.fixforge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Fixforge-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        if (taskId != null) {
            MDC.put("taskId", taskId);
        }
    }

    public static void setFix(String taskId, String workflowId, int issueNumber) {
        setTask(taskId);
        MDC.put("workflowId", workflowId);
        MDC.put("issueNumber", String.valueOf(issueNumber));
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("workflowId");
        MDC.remove("issueNumber");
    }
}
