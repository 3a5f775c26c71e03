package com.entity.semantic.embedding;

/**
 * Configuration of the name-to-vector cache in front of the embedding model.
 *
 * @param maxSize    maximum number of cached names
 * @param ttlSeconds time-to-live of each entry in seconds
 * @param enabled    whether caching is enabled
 */
public record EmbeddingCacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public EmbeddingCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 50,000 names, one hour, enabled.
     */
    public static EmbeddingCacheConfig defaults() {
        return new EmbeddingCacheConfig(50_000, 3_600, true);
    }

    public static EmbeddingCacheConfig disabled() {
        return new EmbeddingCacheConfig(1, 1, false);
    }
}
