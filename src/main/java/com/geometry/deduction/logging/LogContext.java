package com.geometry.deduction.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSolve(sessionId, pass)) {
 *     log.debug("solve.outcome status={}", status);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one pass of the equation solver.
     */
    public static LogContext forSolve(String sessionId, int pass) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("solvePass", Integer.toString(pass));
        ctx.put("operation", "solve");
        return ctx;
    }

    /**
     * Creates a log context for a registry merge.
     */
    public static LogContext forMerge(String kind, String oldKey, String survivorKey) {
        LogContext ctx = new LogContext();
        ctx.put("objectKind", kind);
        ctx.put("oldKey", oldKey);
        ctx.put("survivorKey", survivorKey);
        ctx.put("operation", "merge");
        return ctx;
    }

    /**
     * Creates a log context for derivations driven by one target.
     */
    public static LogContext forTarget(String sessionId, String kind, String key) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("objectKind", kind);
        ctx.put("targetKey", key);
        ctx.put("operation", "derive");
        return ctx;
    }

    public static String generateSessionId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
