package com.document.resource.cache;

import com.document.resource.core.model.ResourceKind;
import com.document.resource.core.model.ResourcePayload;
import com.document.resource.metrics.MetricsService;
import com.document.resource.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Caffeine-backed content cache.
 *
 * <p>Caffeine bounds the number of entries. The TTL is checked here against the injected
 * {@link Clock} rather than by Caffeine's own expiry, so that an entry exactly TTL old is still
 * served and so that {@link #stats()} lists stale entries until a read or sweep removes them.</p>
 */
public class CaffeineContentCache implements ContentCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineContentCache.class);

    private final Cache<String, CacheEntry> cache;
    private final Clock clock;
    private final Duration ttl;
    private final MetricsService metricsService;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder expired = new LongAdder();

    public CaffeineContentCache(CacheConfig config) {
        this(config, Clock.systemUTC(), new NoOpMetricsService());
    }

    public CaffeineContentCache(CacheConfig config, Clock clock, MetricsService metricsService) {
        Objects.requireNonNull(config, "config is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.ttl = config.ttl();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .executor(Runnable::run)
                .recordStats()
                .evictionListener((String key, CacheEntry entry, RemovalCause cause) ->
                        log.debug("cache.evicted key={} cause={}", key, cause))
                .build();
        log.info("CaffeineContentCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttl().toSeconds());
    }

    @Override
    public void store(String key, ResourcePayload content, String text, ResourceKind kind) {
        Objects.requireNonNull(key, "key is required");
        CacheEntry entry = new CacheEntry(content, text, clock.instant(), kind);
        cache.put(key, entry);
        metricsService.recordCacheStore(kind);
        log.debug("cache.stored key={} kind={} textLength={}", key, kind, text.length());
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        Objects.requireNonNull(key, "key is required");
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            recordMiss();
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (entry.isExpiredAt(now, ttl)) {
            // remove(key, entry) leaves a concurrent overwrite in place
            if (cache.asMap().remove(key, entry)) {
                expired.increment();
                log.debug("cache.expired key={} ageSeconds={}", key, entry.ageAt(now).toSeconds());
            }
            recordMiss();
            return Optional.empty();
        }
        hits.increment();
        metricsService.recordCacheHit();
        return Optional.of(entry);
    }

    @Override
    public int sweep() {
        Instant now = clock.instant();
        ConcurrentMap<String, CacheEntry> map = cache.asMap();
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : map.entrySet()) {
            if (e.getValue().isExpiredAt(now, ttl) && map.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            expired.add(removed);
            log.debug("cache.swept removed={} remaining={}", removed, map.size());
        }
        metricsService.recordSweep(removed);
        return removed;
    }

    @Override
    public CacheSnapshot stats() {
        Instant now = clock.instant();
        List<CacheSnapshot.EntrySummary> entries = new ArrayList<>();
        for (Map.Entry<String, CacheEntry> e : cache.asMap().entrySet()) {
            CacheEntry entry = e.getValue();
            long ageSeconds = Math.round(entry.ageAt(now).toMillis() / 1000.0);
            entries.add(new CacheSnapshot.EntrySummary(e.getKey(), entry.kind(), ageSeconds, entry.text().length()));
        }
        entries.sort(Comparator.comparing(CacheSnapshot.EntrySummary::key));
        return new CacheSnapshot(entries.size(), entries);
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(
                hits.sum(),
                misses.sum(),
                cache.stats().evictionCount(),
                expired.sum(),
                cache.estimatedSize()
        );
    }

    @Override
    public void invalidate(String key) {
        cache.invalidate(key);
        log.debug("cache.invalidated key={}", key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    /**
     * Returns the configured TTL.
     */
    public Duration ttl() {
        return ttl;
    }

    private void recordMiss() {
        misses.increment();
        metricsService.recordCacheMiss();
    }
}
