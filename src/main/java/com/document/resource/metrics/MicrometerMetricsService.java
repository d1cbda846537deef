package com.document.resource.metrics;

import com.document.resource.address.ParseFailure;
import com.document.resource.core.model.ResourceKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code document.cache.hit} / {@code document.cache.miss} - Counter</li>
 *   <li>{@code document.cache.stored} - Counter (tag: kind)</li>
 *   <li>{@code document.cache.swept} - Counter of entries removed by sweeps</li>
 *   <li>{@code document.address.invalid} - Counter (tag: reason)</li>
 *   <li>{@code document.resolve.duration} - Timer (tag: outcome)</li>
 *   <li>{@code document.response.truncated} - Counter</li>
 *   <li>{@code document.response.original.length} - DistributionSummary of truncated payload sizes</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter sweptCounter;
    private final Counter truncatedCounter;
    private final DistributionSummary originalLengthSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("document.cache.hit")
                .description("Number of content cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("document.cache.miss")
                .description("Number of content cache misses, expired entries included")
                .register(registry);
        this.sweptCounter = Counter.builder("document.cache.swept")
                .description("Number of stale entries removed by active sweeps")
                .register(registry);
        this.truncatedCounter = Counter.builder("document.response.truncated")
                .description("Number of responses cut down to the character limit")
                .register(registry);
        this.originalLengthSummary = DistributionSummary.builder("document.response.original.length")
                .description("Length of responses before truncation")
                .register(registry);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordCacheStore(ResourceKind kind) {
        Counter counter = counterCache.computeIfAbsent("stored:" + kind.name(), k ->
                Counter.builder("document.cache.stored")
                        .description("Number of entries written to the content cache")
                        .tag("kind", kind.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordSweep(int removed) {
        sweptCounter.increment(removed);
    }

    @Override
    public void recordInvalidAddress(ParseFailure reason) {
        Counter counter = counterCache.computeIfAbsent("invalid:" + reason.name(), k ->
                Counter.builder("document.address.invalid")
                        .description("Number of content addresses rejected by the parser")
                        .tag("reason", reason.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordResolveDuration(String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("document.resolve.duration")
                        .description("Duration of content address resolution")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordTruncation(int originalLength) {
        truncatedCounter.increment();
        originalLengthSummary.record(originalLength);
    }
}
