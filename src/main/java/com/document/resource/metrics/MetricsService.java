package com.document.resource.metrics;

import com.document.resource.address.ParseFailure;
import com.document.resource.core.model.ResourceKind;

import java.time.Duration;

/**
 * Interface for recording content cache metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordCacheHit();

    void recordCacheMiss();

    void recordCacheStore(ResourceKind kind);

    void recordSweep(int removed);

    void recordInvalidAddress(ParseFailure reason);

    void recordResolveDuration(String outcome, Duration duration);

    void recordTruncation(int originalLength);
}
