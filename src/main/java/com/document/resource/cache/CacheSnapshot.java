package com.document.resource.cache;

import com.document.resource.core.model.ResourceKind;

import java.util.List;

/**
 * Read-only listing of the cache contents, for diagnostics.
 *
 * @param size    number of entries held, stale ones included
 * @param entries one summary per entry, ordered by key
 */
public record CacheSnapshot(int size, List<EntrySummary> entries) {

    public CacheSnapshot {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public static CacheSnapshot empty() {
        return new CacheSnapshot(0, List.of());
    }

    /**
     * @param key        the cache key
     * @param kind       the resource kind
     * @param ageSeconds age of the entry, rounded to the nearest second
     * @param textLength length of the cached text
     */
    public record EntrySummary(String key, ResourceKind kind, long ageSeconds, int textLength) {
    }
}
