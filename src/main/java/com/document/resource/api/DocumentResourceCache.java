package com.document.resource.api;

import com.document.resource.address.AddressParser;
import com.document.resource.address.ParsedAddress;
import com.document.resource.address.ResourceAddresses;
import com.document.resource.cache.CacheConfig;
import com.document.resource.cache.CacheEntry;
import com.document.resource.cache.CacheSnapshot;
import com.document.resource.cache.CacheStats;
import com.document.resource.cache.CacheSweeper;
import com.document.resource.cache.CaffeineContentCache;
import com.document.resource.cache.ContentCache;
import com.document.resource.cache.NoOpContentCache;
import com.document.resource.core.model.ResourceKind;
import com.document.resource.core.model.ResourcePayload;
import com.document.resource.core.model.SpreadsheetPayload;
import com.document.resource.ingest.IngestResult;
import com.document.resource.ingest.IngestService;
import com.document.resource.ingest.ReturnMode;
import com.document.resource.logging.LogContext;
import com.document.resource.mcp.LegacyResourceReader;
import com.document.resource.mcp.ResourceDescriptor;
import com.document.resource.mcp.ResourceReadHandler;
import com.document.resource.mcp.ResourceReadResponse;
import com.document.resource.metrics.MetricsService;
import com.document.resource.metrics.NoOpMetricsService;
import com.document.resource.resolve.ContentResolver;
import com.document.resource.resolve.ResolvedContent;
import com.document.resource.truncation.TruncationGuard;
import com.document.resource.truncation.TruncationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point: caches fetched document text and serves bounded slices of it by address.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (DocumentResourceCache resources = DocumentResourceCache.builder().build()) {
 *     // a fetch operation in summary mode
 *     IngestResult.Summary summary = (IngestResult.Summary) resources.ingest(document, ReturnMode.SUMMARY);
 *
 *     // later, the agent pages through the text
 *     ResolvedContent first = resources.read("gdrive://docs/" + document.documentId() + "/chunk/0-5000");
 *
 *     // anything returned inline goes through the guard
 *     TruncationResult bounded = resources.truncate(largeResponse);
 * }
 * </pre>
 *
 * <p>One instance per process; components are shared by reference.</p>
 */
public class DocumentResourceCache implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DocumentResourceCache.class);

    private final CacheConfig cacheConfig;
    private final ContentCache cache;
    private final AddressParser parser;
    private final ResourceAddresses addresses;
    private final ContentResolver resolver;
    private final TruncationGuard truncationGuard;
    private final IngestService ingestService;
    private final ResourceReadHandler readHandler;
    private final CacheSweeper sweeper;

    private DocumentResourceCache(Builder builder) {
        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.cacheConfig = builder.cacheConfig;
        if (builder.contentCache != null) {
            this.cache = builder.contentCache;
        } else if (cacheConfig.enabled()) {
            this.cache = new CaffeineContentCache(cacheConfig, builder.clock, metrics);
        } else {
            this.cache = new NoOpContentCache();
        }
        this.parser = new AddressParser(builder.scheme);
        this.addresses = new ResourceAddresses(builder.scheme);
        this.resolver = new ContentResolver(cache, addresses, metrics);
        this.truncationGuard = new TruncationGuard(builder.truncationLimit, metrics);
        this.ingestService = new IngestService(cache, cacheConfig.enabled(), truncationGuard, addresses,
                builder.clock, builder.chunkSize);
        this.readHandler = new ResourceReadHandler(parser, resolver, cache, addresses, builder.legacyReader);
        this.sweeper = cacheConfig.sweepEnabled() && builder.sweeperEnabled
                ? new CacheSweeper(cache, cacheConfig.sweepInterval())
                : null;
        log.info("DocumentResourceCache initialized: scheme={}, cacheEnabled={}, sweeper={}",
                builder.scheme, cacheConfig.enabled(), sweeper != null);
    }

    // ========== Cache ==========

    public void store(String key, ResourcePayload content, String text, ResourceKind kind) {
        cache.store(key, content, text, kind);
    }

    public void store(String key, ResourcePayload payload) {
        cache.store(key, payload);
    }

    public Optional<CacheEntry> get(String key) {
        return cache.get(key);
    }

    public int sweep() {
        return cache.sweep();
    }

    public CacheSnapshot stats() {
        return cache.stats();
    }

    public CacheStats cacheStats() {
        return cache.getStats();
    }

    // ========== Addressing ==========

    public ParsedAddress parse(String uri) {
        return parser.parse(uri);
    }

    public ResolvedContent resolve(ParsedAddress parsed) {
        return resolver.resolve(parsed);
    }

    /**
     * Parses and resolves an address.
     */
    public ResolvedContent read(String uri) {
        try (LogContext ignored = LogContext.forRead(uri)) {
            return resolver.resolve(parser.parse(uri));
        }
    }

    /**
     * Reads an address as an MCP resource: text on success, a JSON error body otherwise.
     */
    public ResourceReadResponse readResource(String uri) {
        return readHandler.read(uri);
    }

    public List<ResourceDescriptor> listCachedResources() {
        return readHandler.listCachedResources();
    }

    // ========== Ingest and truncation ==========

    public IngestResult ingest(ResourcePayload payload, ReturnMode mode) {
        return ingestService.ingest(payload, mode);
    }

    public IngestResult ingestValueRanges(SpreadsheetPayload payload, ReturnMode mode) {
        return ingestService.ingestValueRanges(payload, mode);
    }

    /**
     * Drops cached copies of a resource after it changed remotely.
     */
    public int evict(String resourceId) {
        return ingestService.evict(resourceId);
    }

    public TruncationResult truncate(String text) {
        return truncationGuard.truncate(text);
    }

    public TruncationResult truncate(String text, int limit, String hint) {
        return truncationGuard.truncate(text, limit, hint);
    }

    // ========== Components ==========

    public ContentCache getCache() {
        return cache;
    }

    public AddressParser getParser() {
        return parser;
    }

    public ResourceAddresses getAddresses() {
        return addresses;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public boolean isSweeperRunning() {
        return sweeper != null && sweeper.isRunning();
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Clock clock = Clock.systemUTC();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private ContentCache contentCache;
        private String scheme = AddressParser.DEFAULT_SCHEME;
        private int truncationLimit = TruncationGuard.DEFAULT_LIMIT;
        private int chunkSize = IngestService.DEFAULT_CHUNK_SIZE;
        private MetricsService metricsService;
        private LegacyResourceReader legacyReader;
        private boolean sweeperEnabled = true;

        /**
         * Sets the clock TTLs are measured against. Defaults to the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Uses a custom cache implementation instead of the Caffeine-backed one.
         */
        public Builder contentCache(ContentCache contentCache) {
            this.contentCache = contentCache;
            return this;
        }

        /**
         * Sets the address scheme. Defaults to {@code gdrive}.
         */
        public Builder scheme(String scheme) {
            this.scheme = scheme;
            return this;
        }

        public Builder truncationLimit(int truncationLimit) {
            this.truncationLimit = truncationLimit;
            return this;
        }

        /**
         * Sets the chunk size suggested in summaries. Defaults to 5,000 characters.
         */
        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder legacyReader(LegacyResourceReader legacyReader) {
            this.legacyReader = legacyReader;
            return this;
        }

        /**
         * Disables the background sweep regardless of the configured interval; lazy expiry
         * still applies.
         */
        public Builder withoutSweeper() {
            this.sweeperEnabled = false;
            return this;
        }

        public DocumentResourceCache build() {
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            if (cacheConfig == null) {
                throw new IllegalStateException("CacheConfig is required");
            }
            if (scheme == null) {
                throw new IllegalStateException("Scheme is required");
            }
            return new DocumentResourceCache(this);
        }
    }
}
