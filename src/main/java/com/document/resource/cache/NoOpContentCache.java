package com.document.resource.cache;

import com.document.resource.core.model.ResourceKind;
import com.document.resource.core.model.ResourcePayload;

import java.util.Optional;

/**
 * No-op cache implementation. Stores nothing, so every read is a miss.
 * Used when caching is disabled.
 */
public class NoOpContentCache implements ContentCache {

    @Override
    public void store(String key, ResourcePayload content, String text, ResourceKind kind) {
        // no-op
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        return Optional.empty();
    }

    @Override
    public int sweep() {
        return 0;
    }

    @Override
    public CacheSnapshot stats() {
        return CacheSnapshot.empty();
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }

    @Override
    public void invalidate(String key) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }
}
