package com.geometry.deduction.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forSolve should set sessionId, solvePass, and operation in MDC")
    void forSolveSetsMDC() {
        try (LogContext ctx = LogContext.forSolve("session-1", 3)) {
            assertEquals("session-1", MDC.get("sessionId"));
            assertEquals("3", MDC.get("solvePass"));
            assertEquals("solve", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forMerge should set objectKind, oldKey, survivorKey, and operation in MDC")
    void forMergeSetsMDC() {
        try (LogContext ctx = LogContext.forMerge("Line", "A B", "A B C")) {
            assertEquals("Line", MDC.get("objectKind"));
            assertEquals("A B", MDC.get("oldKey"));
            assertEquals("A B C", MDC.get("survivorKey"));
            assertEquals("merge", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forTarget should set sessionId, objectKind, targetKey, and operation in MDC")
    void forTargetSetsMDC() {
        try (LogContext ctx = LogContext.forTarget("session-2", "Segment", "A B")) {
            assertEquals("session-2", MDC.get("sessionId"));
            assertEquals("Segment", MDC.get("objectKind"));
            assertEquals("A B", MDC.get("targetKey"));
            assertEquals("derive", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forSolve("session-1", 1).with("extra", "value");
        assertEquals("value", MDC.get("extra"));

        ctx.close();

        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("solvePass"));
        assertNull(MDC.get("extra"));
    }

    @Test
    @DisplayName("Should leave unrelated MDC keys alone")
    void keepsForeignKeys() {
        MDC.put("requestId", "r-1");

        try (LogContext ctx = LogContext.forTarget("session-3", "Angle", "A B C")) {
            assertEquals("r-1", MDC.get("requestId"));
        }

        assertEquals("r-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("generateSessionId should produce unique values")
    void generateSessionIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateSessionId());
        }
        assertEquals(100, ids.size());
    }
}
