package com.document.resource.ingest;

import com.document.resource.address.ChunkRange;
import com.document.resource.address.ResourceAddresses;
import com.document.resource.cache.CacheSnapshot;
import com.document.resource.cache.ContentCache;
import com.document.resource.core.model.ResourcePayload;
import com.document.resource.core.model.SpreadsheetPayload;
import com.document.resource.logging.LogContext;
import com.document.resource.truncation.TruncationGuard;
import com.document.resource.truncation.TruncationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Entry point for fetch operations that have pulled a resource from the remote API.
 *
 * <p>In {@link ReturnMode#SUMMARY} the text is cached and the caller receives the addresses to read
 * it from in bounded chunks. In {@link ReturnMode#FULL} the text is returned inline through the
 * {@link TruncationGuard}. When caching is disabled, summary requests are served as full ones.</p>
 */
public class IngestService {
    private static final Logger log = LoggerFactory.getLogger(IngestService.class);

    public static final int DEFAULT_CHUNK_SIZE = 5_000;

    private final ContentCache cache;
    private final boolean cachingEnabled;
    private final TruncationGuard truncationGuard;
    private final ResourceAddresses addresses;
    private final Clock clock;
    private final int chunkSize;

    public IngestService(ContentCache cache, boolean cachingEnabled, TruncationGuard truncationGuard,
                         ResourceAddresses addresses, Clock clock, int chunkSize) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.cachingEnabled = cachingEnabled;
        this.truncationGuard = Objects.requireNonNull(truncationGuard, "truncationGuard is required");
        this.addresses = Objects.requireNonNull(addresses, "addresses is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        this.chunkSize = chunkSize;
    }

    /**
     * Ingests a whole resource, cached under its ID.
     */
    public IngestResult ingest(ResourcePayload payload, ReturnMode mode) {
        Objects.requireNonNull(payload, "payload is required");
        return ingest(CacheKeys.forPayload(payload), payload, mode);
    }

    /**
     * Ingests specific value ranges of a spreadsheet, cached under a composite key so that other
     * range sets of the same spreadsheet stay cached alongside.
     */
    public IngestResult ingestValueRanges(SpreadsheetPayload payload, ReturnMode mode) {
        Objects.requireNonNull(payload, "payload is required");
        return ingest(CacheKeys.forSheetRanges(payload.spreadsheetId(), payload.ranges()), payload, mode);
    }

    /**
     * Drops every cached copy of a resource, composite keys included. Called after the resource
     * was modified or deleted remotely.
     *
     * @return the number of entries dropped
     */
    public int evict(String resourceId) {
        Objects.requireNonNull(resourceId, "resourceId is required");
        int evicted = 0;
        for (CacheSnapshot.EntrySummary entry : cache.stats().entries()) {
            if (CacheKeys.belongsTo(entry.key(), resourceId)) {
                cache.invalidate(entry.key());
                evicted++;
            }
        }
        log.debug("ingest.evicted resourceId={} entries={}", resourceId, evicted);
        return evicted;
    }

    private IngestResult ingest(String key, ResourcePayload payload, ReturnMode mode) {
        ReturnMode effective = mode != null ? mode : ReturnMode.DEFAULT;
        try (LogContext ignored = LogContext.forIngest(payload.resourceId(), payload.kind()).with("cacheKey", key)) {
            String text = payload.extractText();
            if (effective == ReturnMode.SUMMARY && cachingEnabled) {
                cache.store(key, payload, text, payload.kind());
                log.info("ingest.cached key={} kind={} textLength={}", key, payload.kind(), text.length());
                return summarize(key, payload, text);
            }
            if (effective == ReturnMode.SUMMARY) {
                log.debug("ingest.cacheDisabled key={} returning full content", key);
            }
            TruncationResult bounded = truncationGuard.truncateWithHint(text, fullModeHint(key, payload));
            log.info("ingest.full key={} kind={} truncated={}", key, payload.kind(), bounded.truncated());
            return new IngestResult.Full(payload.resourceId(), payload.kind(), bounded);
        }
    }

    private IngestResult.Summary summarize(String key, ResourcePayload payload, String text) {
        int length = text.length();
        int chunkCount = length == 0 ? 0 : (length + chunkSize - 1) / chunkSize;
        return new IngestResult.Summary(
                payload.resourceId(),
                key,
                payload.displayName(),
                payload.kind(),
                length,
                clock.instant(),
                addresses.contentAddress(payload.kind(), key),
                addresses.rangeAddress(payload.kind(), key, new ChunkRange(0, chunkSize)),
                chunkSize,
                chunkCount
        );
    }

    private String fullModeHint(String key, ResourcePayload payload) {
        if (!cachingEnabled) {
            return "Request a narrower scope to see the rest of this content.";
        }
        return "Use returnMode: 'summary' to cache this content, then read it in chunks via "
                + addresses.rangeAddress(payload.kind(), key, new ChunkRange(0, chunkSize));
    }
}
