package com.document.resource.metrics;

import com.document.resource.address.ParseFailure;
import com.document.resource.core.model.ResourceKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordCacheStore(ResourceKind kind) {
    }

    @Override
    public void recordSweep(int removed) {
    }

    @Override
    public void recordInvalidAddress(ParseFailure reason) {
    }

    @Override
    public void recordResolveDuration(String outcome, Duration duration) {
    }

    @Override
    public void recordTruncation(int originalLength) {
    }
}
