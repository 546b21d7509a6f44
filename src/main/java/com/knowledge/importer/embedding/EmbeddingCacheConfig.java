package com.knowledge.importer.embedding;

/**
 * Sizing for {@link CachingEmbeddingGateway}.
 *
 * @param maxSize    maximum number of cached vectors
 * @param ttlSeconds time-to-live of each entry
 */
public record EmbeddingCacheConfig(int maxSize, int ttlSeconds) {

    public EmbeddingCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 10,000 vectors for one hour.
     */
    public static EmbeddingCacheConfig defaults() {
        return new EmbeddingCacheConfig(10_000, 3_600);
    }
}
