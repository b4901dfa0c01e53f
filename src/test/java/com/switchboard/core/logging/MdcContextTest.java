package com.switchboard.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setOperation puts operationId and userId in MDC")
    void setOperation() {
        MdcContext.setOperation("op-1", "alice");
        assertEquals("op-1", MDC.get("operationId"));
        assertEquals("alice", MDC.get("userId"));
    }

    @Test
    @DisplayName("a null user removes a stale userId")
    void nullUserRemovesKey() {
        MdcContext.setOperation("op-1", "alice");
        MdcContext.setOperation("op-2", null);
        assertEquals("op-2", MDC.get("operationId"));
        assertNull(MDC.get("userId"));
    }

    @Test
    @DisplayName("clearStage keeps the operation keys")
    void clearStage() {
        MdcContext.setOperation("op-1", "alice");
        MdcContext.setStage("SAFETY");
        assertEquals("SAFETY", MDC.get("stage"));

        MdcContext.clearStage();
        assertNull(MDC.get("stage"));
        assertEquals("op-1", MDC.get("operationId"));
    }

    @Test
    @DisplayName("clear removes all switchboard MDC keys")
    void clear() {
        MdcContext.setOperation("op-1", "alice");
        MdcContext.setStage("INTENT");
        MdcContext.clear();
        assertNull(MDC.get("operationId"));
        assertNull(MDC.get("userId"));
        assertNull(MDC.get("stage"));
    }
}
