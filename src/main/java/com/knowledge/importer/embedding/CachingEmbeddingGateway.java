package com.knowledge.importer.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed memo of embedding vectors keyed by input text.
 * Only successful lookups are cached, so a transient failure is retried on the next call.
 */
public class CachingEmbeddingGateway implements EmbeddingGateway {
    private static final Logger log = LoggerFactory.getLogger(CachingEmbeddingGateway.class);

    private final EmbeddingGateway delegate;
    private final Cache<String, float[]> cache;

    public CachingEmbeddingGateway(EmbeddingGateway delegate, EmbeddingCacheConfig config) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingEmbeddingGateway initialized: model={}, maxSize={}, ttl={}s",
                delegate.getModel(), config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<float[]> embed(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        float[] cached = cache.getIfPresent(text);
        if (cached != null) {
            return Optional.of(cached.clone());
        }
        Optional<float[]> computed = delegate.embed(text);
        computed.ifPresent(vector -> cache.put(text, vector.clone()));
        return computed;
    }

    @Override
    public String getModel() {
        return delegate.getModel();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
