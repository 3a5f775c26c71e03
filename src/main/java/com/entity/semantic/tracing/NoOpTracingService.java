package com.entity.semantic.tracing;

/**
 * Tracing disabled.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span start(TracedOperation operation, String subject) {
        return Span.NOOP;
    }
}
