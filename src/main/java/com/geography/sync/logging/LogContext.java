package com.geography.sync.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper around the SLF4J MDC. Entries put through a context
 * are removed when it closes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forIngest(correlationId, tenantId, 3)) {
 *     log.info("ingest.accepted unitId={}", unitId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forIngest(String correlationId, String tenantId, int level) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("tenantId", tenantId);
        ctx.put("level", String.valueOf(level));
        ctx.put("operation", "ingest");
        return ctx;
    }

    public static LogContext forMerge(String correlationId, String primaryId, String secondaryId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("primaryUnitId", primaryId);
        ctx.put("secondaryUnitId", secondaryId);
        ctx.put("operation", "merge");
        return ctx;
    }

    public static LogContext forConflict(String correlationId, String caseId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("caseId", caseId);
        ctx.put("operation", "conflict");
        return ctx;
    }

    public static LogContext forImport(String importId) {
        LogContext ctx = new LogContext();
        ctx.put("importId", importId);
        ctx.put("operation", "import");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds another entry to this context.
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
        keys.forEach(MDC::remove);
        keys.clear();
    }
}
