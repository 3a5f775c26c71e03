package com.entity.semantic.embedding;

/**
 * Batching, concurrency and retry settings of {@link EmbeddingProvider}.
 */
public class EmbeddingOptions {

    private static final int DEFAULT_BATCH_SIZE = 32;
    private static final int DEFAULT_MAX_RETRIES = 2;
    private static final long DEFAULT_RETRY_BACKOFF_MS = 100;

    private final int batchSize;
    private final int threads;
    private final int maxRetries;
    private final long retryBackoffMs;
    private final EmbeddingCacheConfig cacheConfig;

    private EmbeddingOptions(Builder builder) {
        this.batchSize = builder.batchSize;
        this.threads = builder.threads;
        this.maxRetries = builder.maxRetries;
        this.retryBackoffMs = builder.retryBackoffMs;
        this.cacheConfig = builder.cacheConfig;
    }

    public int getBatchSize() { return batchSize; }
    public int getThreads() { return threads; }
    public int getMaxRetries() { return maxRetries; }
    public long getRetryBackoffMs() { return retryBackoffMs; }
    public EmbeddingCacheConfig getCacheConfig() { return cacheConfig; }

    public static EmbeddingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int threads = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long retryBackoffMs = DEFAULT_RETRY_BACKOFF_MS;
        private EmbeddingCacheConfig cacheConfig = EmbeddingCacheConfig.defaults();

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
            this.batchSize = batchSize;
            return this;
        }

        public Builder threads(int threads) {
            if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
            this.threads = threads;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryBackoffMs(long retryBackoffMs) {
            if (retryBackoffMs < 0) throw new IllegalArgumentException("retryBackoffMs must be >= 0");
            this.retryBackoffMs = retryBackoffMs;
            return this;
        }

        public Builder cacheConfig(EmbeddingCacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig != null ? cacheConfig : EmbeddingCacheConfig.disabled();
            return this;
        }

        public EmbeddingOptions build() {
            return new EmbeddingOptions(this);
        }
    }

    @Override
    public String toString() {
        return "EmbeddingOptions{" +
                "batchSize=" + batchSize +
                ", threads=" + threads +
                ", maxRetries=" + maxRetries +
                ", retryBackoffMs=" + retryBackoffMs +
                ", cache=" + cacheConfig +
                '}';
    }
}
