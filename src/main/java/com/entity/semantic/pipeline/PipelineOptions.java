package com.entity.semantic.pipeline;

import java.time.Duration;

/**
 * Options for the ingestion and query pipelines.
 * Configures the similarity threshold, result limit, query deadline and worker pool.
 */
public class PipelineOptions {

    private static final double DEFAULT_THRESHOLD = 0.75;
    private static final int DEFAULT_LIMIT = 10;
    private static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(5);
    private static final int DEFAULT_UNAVAILABLE_RETRIES = 3;
    private static final long DEFAULT_UNAVAILABLE_BACKOFF_MS = 50;

    private final double threshold;
    private final int limit;
    private final Duration queryTimeout;
    private final int workerThreads;
    private final int unavailableRetries;
    private final long unavailableBackoffMs;

    private PipelineOptions(Builder builder) {
        this.threshold = builder.threshold;
        this.limit = builder.limit;
        this.queryTimeout = builder.queryTimeout;
        this.workerThreads = builder.workerThreads;
        this.unavailableRetries = builder.unavailableRetries;
        this.unavailableBackoffMs = builder.unavailableBackoffMs;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Per-query deadline, or null for none.
     */
    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    /**
     * How many times a query is retried while the index is still initializing.
     */
    public int getUnavailableRetries() {
        return unavailableRetries;
    }

    public long getUnavailableBackoffMs() {
        return unavailableBackoffMs;
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double threshold = DEFAULT_THRESHOLD;
        private int limit = DEFAULT_LIMIT;
        private Duration queryTimeout = DEFAULT_QUERY_TIMEOUT;
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private int unavailableRetries = DEFAULT_UNAVAILABLE_RETRIES;
        private long unavailableBackoffMs = DEFAULT_UNAVAILABLE_BACKOFF_MS;

        public Builder threshold(double threshold) {
            validateThreshold(threshold);
            this.threshold = threshold;
            return this;
        }

        public Builder limit(int limit) {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be > 0");
            }
            this.limit = limit;
            return this;
        }

        public Builder queryTimeout(Duration queryTimeout) {
            if (queryTimeout != null && (queryTimeout.isNegative() || queryTimeout.isZero())) {
                throw new IllegalArgumentException("queryTimeout must be positive");
            }
            this.queryTimeout = queryTimeout;
            return this;
        }

        public Builder noQueryTimeout() {
            this.queryTimeout = null;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("workerThreads must be > 0");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder unavailableRetries(int unavailableRetries) {
            if (unavailableRetries < 0) {
                throw new IllegalArgumentException("unavailableRetries must be >= 0");
            }
            this.unavailableRetries = unavailableRetries;
            return this;
        }

        public Builder unavailableBackoffMs(long unavailableBackoffMs) {
            if (unavailableBackoffMs < 0) {
                throw new IllegalArgumentException("unavailableBackoffMs must be >= 0");
            }
            this.unavailableBackoffMs = unavailableBackoffMs;
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(this);
        }
    }

    /**
     * Similarity is raw cosine, so thresholds range over [-1, 1].
     */
    static void validateThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold < -1.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between -1.0 and 1.0, got " + threshold);
        }
    }

    @Override
    public String toString() {
        return "PipelineOptions{" +
                "threshold=" + threshold +
                ", limit=" + limit +
                ", queryTimeout=" + queryTimeout +
                ", workerThreads=" + workerThreads +
                ", unavailableRetries=" + unavailableRetries +
                ", unavailableBackoffMs=" + unavailableBackoffMs +
                '}';
    }
}
