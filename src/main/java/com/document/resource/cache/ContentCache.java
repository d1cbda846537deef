package com.document.resource.cache;

import com.document.resource.core.model.ResourceKind;
import com.document.resource.core.model.ResourcePayload;

import java.util.Optional;

/**
 * Transient store of fetched resource content, keyed by a caller-chosen string.
 *
 * <p>By convention the key is the remote resource ID, so that the resource ID parsed from a
 * content address finds the entry stored by the ingest operation that fetched it. Entries expire
 * after the configured TTL: lazily when a read finds them stale, and actively on {@link #sweep()}.</p>
 */
public interface ContentCache {

    /**
     * Stores an entry, replacing any existing entry for the key and restarting its TTL.
     *
     * @param key     the cache key
     * @param content the raw payload
     * @param text    the text derived from the payload
     * @param kind    the resource kind
     */
    void store(String key, ResourcePayload content, String text, ResourceKind kind);

    /**
     * Stores a payload with the text it extracts.
     */
    default void store(String key, ResourcePayload payload) {
        store(key, payload, payload.extractText(), payload.kind());
    }

    /**
     * Gets a live entry. A stale entry is removed and reported as absent.
     *
     * @param key the cache key
     * @return the entry, or empty if none exists or it has expired
     */
    Optional<CacheEntry> get(String key);

    /**
     * Removes every stale entry, whether or not it has been read.
     *
     * @return the number of entries removed
     */
    int sweep();

    /**
     * Lists the entries without evicting anything.
     */
    CacheSnapshot stats();

    /**
     * Returns hit, miss and eviction counters.
     */
    CacheStats getStats();

    /**
     * Removes the entry for the key, if present.
     */
    void invalidate(String key);

    /**
     * Removes all entries.
     */
    void invalidateAll();
}
