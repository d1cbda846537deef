package com.document.resource.cache;

import com.document.resource.core.model.ResourceKind;
import com.document.resource.core.model.ResourcePayload;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached remote resource: the raw payload, the text derived from it, and when it was stored.
 * Entries are immutable; a later store under the same key replaces the entry as a whole.
 *
 * @param content   the raw payload as returned by the remote API
 * @param text      the flattened text that chunk addresses slice
 * @param fetchedAt time of the store that created this entry
 * @param kind      the resource kind, for diagnostics
 */
public record CacheEntry(ResourcePayload content, String text, Instant fetchedAt, ResourceKind kind) {

    public CacheEntry {
        Objects.requireNonNull(content, "content is required");
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        Objects.requireNonNull(kind, "kind is required");
    }

    /**
     * Returns the age of this entry at the given instant.
     */
    public Duration ageAt(Instant now) {
        return Duration.between(fetchedAt, now);
    }

    /**
     * An entry is stale once its age strictly exceeds the TTL; an entry exactly TTL old is still served.
     */
    public boolean isExpiredAt(Instant now, Duration ttl) {
        return ageAt(now).compareTo(ttl) > 0;
    }
}
