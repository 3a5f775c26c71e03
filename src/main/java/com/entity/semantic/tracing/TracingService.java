package com.entity.semantic.tracing;

/**
 * Tracing seam for the candidate-generation pipelines.
 * The default {@link NoOpTracingService} does nothing, so the library runs without any
 * tracing dependency on the classpath.
 */
public interface TracingService {

    /**
     * Starts a span for one run of {@code operation}.
     *
     * @param subject what the run works on (batch id, request id, model or store name); may be null
     */
    Span start(TracedOperation operation, String subject);

    default Span start(TracedOperation operation) {
        return start(operation, null);
    }
}
