package com.fixforge.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    void setTaskPutsTaskId() {
        MdcContext.setTask("42");
        assertEquals("42", MDC.get("taskId"));
    }

    @Test
    void setTaskIgnoresNull() {
        MdcContext.setTask(null);
        assertNull(MDC.get("taskId"));
    }

    @Test
    void setFixPutsAllKeys() {
        MdcContext.setFix("3", "3-fix-17", 17);
        assertEquals("3", MDC.get("taskId"));
        assertEquals("3-fix-17", MDC.get("workflowId"));
        assertEquals("17", MDC.get("issueNumber"));
    }

    @Test
    void clearRemovesAllKeys() {
        MdcContext.setFix("3", "3-fix-17", 17);
        MdcContext.clear();
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("workflowId"));
        assertNull(MDC.get("issueNumber"));
    }

    @Test
    void clearLeavesOtherKeys() {
        MDC.put("requestId", "r1");
        try {
            MdcContext.setTask("1");
            MdcContext.clear();
            assertEquals("r1", MDC.get("requestId"));
        } finally {
            MDC.remove("requestId");
        }
    }
}
