package com.entity.semantic.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Every span carries {@code semantic.operation} and, when given, the operation's subject
 * attribute. Measurements become {@code <span name>.<measure>} attributes and the outcome
 * is recorded as {@code semantic.status}.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String OPERATION_KEY = "semantic.operation";
    static final String STATUS_KEY = "semantic.status";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span start(TracedOperation operation, String subject) {
        SpanBuilder builder = tracer.spanBuilder(operation.spanName())
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(OPERATION_KEY, operation.name());
        if (subject != null) {
            builder.setAttribute(operation.subjectKey(), subject);
        }
        return new OperationSpan(operation, builder.startSpan());
    }

    private static final class OperationSpan implements Span {

        private final TracedOperation operation;
        private final io.opentelemetry.api.trace.Span otelSpan;

        OperationSpan(TracedOperation operation, io.opentelemetry.api.trace.Span otelSpan) {
            this.operation = operation;
            this.otelSpan = otelSpan;
        }

        @Override
        public void count(String measure, long value) {
            otelSpan.setAttribute(operation.measureKey(measure), value);
        }

        @Override
        public void outcome(String status, boolean failed) {
            otelSpan.setAttribute(STATUS_KEY, status);
            if (failed) {
                otelSpan.setStatus(StatusCode.ERROR, operation.spanName() + " ended " + status);
            } else {
                otelSpan.setStatus(StatusCode.OK);
            }
        }

        @Override
        public void fail(Throwable t) {
            otelSpan.recordException(t);
            otelSpan.setStatus(StatusCode.ERROR, String.valueOf(t.getMessage()));
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
