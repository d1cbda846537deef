package com.document.resource.logging;

import com.document.resource.core.model.ResourceKind;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRead(uri)) {
 *     log.debug("resolve.hit resourceId={} length={}", id, length);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for reading a content address.
     */
    public static LogContext forRead(String uri) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("address", String.valueOf(uri));
        ctx.put("operation", "read");
        return ctx;
    }

    /**
     * Creates a log context for caching a fetched resource.
     */
    public static LogContext forIngest(String resourceId, ResourceKind kind) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("resourceId", resourceId);
        ctx.put("resourceKind", kind.name());
        ctx.put("operation", "ingest");
        return ctx;
    }

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
