package com.entity.semantic.tracing;

/**
 * One traced run of a {@link TracedOperation}. Closing the span ends it:
 * <pre>
 * try (Span span = tracing.start(TracedOperation.QUERY, requestId)) {
 *     span.count("hits", hits.size());
 *     span.outcome(status.name(), status.isError());
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    Span NOOP = new Span() {
        @Override
        public void count(String measure, long value) {
        }

        @Override
        public void outcome(String status, boolean failed) {
        }

        @Override
        public void fail(Throwable t) {
        }

        @Override
        public void close() {
        }
    };

    /**
     * Records a measurement of the run under the operation's own attribute prefix.
     */
    void count(String measure, long value);

    /**
     * Records how the run ended. A failed outcome marks the span as an error.
     */
    void outcome(String status, boolean failed);

    /**
     * Records an exception that aborted the run.
     */
    void fail(Throwable t);

    @Override
    void close();
}
