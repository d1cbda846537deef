package com.document.resource.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the content cache.
 *
 * @param maxSize       maximum number of entries
 * @param ttl           time-to-live of each entry, measured from its most recent store
 * @param sweepInterval period of the active sweep, {@link Duration#ZERO} to rely on lazy expiry only
 * @param enabled       whether caching is enabled
 */
public record CacheConfig(int maxSize, Duration ttl, Duration sweepInterval, boolean enabled) {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(5);

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        Objects.requireNonNull(sweepInterval, "sweepInterval is required");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        if (sweepInterval.isNegative()) {
            throw new IllegalArgumentException("sweepInterval must not be negative");
        }
    }

    /**
     * Default cache configuration: 1,000 entries, 30 minute TTL, sweep every 5 minutes, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, DEFAULT_TTL, DEFAULT_SWEEP_INTERVAL, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, DEFAULT_TTL, Duration.ZERO, false);
    }

    public CacheConfig withTtl(Duration ttl) {
        return new CacheConfig(maxSize, ttl, sweepInterval, enabled);
    }

    public CacheConfig withMaxSize(int maxSize) {
        return new CacheConfig(maxSize, ttl, sweepInterval, enabled);
    }

    public CacheConfig withSweepInterval(Duration sweepInterval) {
        return new CacheConfig(maxSize, ttl, sweepInterval, enabled);
    }

    public boolean sweepEnabled() {
        return enabled && !sweepInterval.isZero();
    }
}
