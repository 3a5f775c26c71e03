package com.entity.semantic.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Keys added through a context are removed when it closes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forIngestion("CUSTOMERS:1001")) {
 *     log.info("ingest.indexed name='{}'", name);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forIngestion(String identifier) {
        LogContext ctx = new LogContext();
        ctx.put("identifier", identifier);
        ctx.put("operation", "ingest");
        return ctx;
    }

    public static LogContext forQuery(String requestId) {
        LogContext ctx = new LogContext();
        ctx.put("requestId", requestId);
        ctx.put("operation", "query");
        return ctx;
    }

    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

    public static LogContext forRebuild(String storeName) {
        LogContext ctx = new LogContext();
        ctx.put("store", storeName);
        ctx.put("operation", "rebuild");
        return ctx;
    }

    public static String generateBatchId() {
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
