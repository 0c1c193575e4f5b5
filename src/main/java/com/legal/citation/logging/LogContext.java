package com.legal.citation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forDocument(sourceNodeId, lawName)) {
 *     log.info("citation.resolved rule={} outcome={}", rule, outcome);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for resolving the citations of one text.
     */
    public static LogContext forDocument(String sourceNodeId, String lawName) {
        LogContext ctx = new LogContext();
        ctx.put("sourceNode", sourceNodeId);
        ctx.put("law", lawName);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Creates a log context for batch operations.
     */
    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

    /**
     * Creates a log context for a link check over a vault.
     */
    public static LogContext forLinkCheck(String vaultRoot) {
        LogContext ctx = new LogContext();
        ctx.put("vault", vaultRoot);
        ctx.put("operation", "link-check");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
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
