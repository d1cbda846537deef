package com.document.resource.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link ContentCache#sweep()} periodically on a daemon thread, so that entries which are
 * never read again are still reclaimed. Lazy expiry on read keeps working alongside.
 */
public class CacheSweeper implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

    private final ContentCache cache;
    private final ScheduledExecutorService scheduler;

    public CacheSweeper(ContentCache cache, Duration interval) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
        Objects.requireNonNull(interval, "interval is required");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "content-cache-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::runSweep, millis, millis, TimeUnit.MILLISECONDS);
        log.info("CacheSweeper started: interval={}ms", millis);
    }

    /**
     * Performs one sweep. Failures are logged so the schedule keeps running.
     */
    int runSweep() {
        try {
            int removed = cache.sweep();
            if (removed > 0) {
                log.debug("sweeper.completed removed={}", removed);
            }
            return removed;
        } catch (RuntimeException e) {
            log.warn("sweeper.failed", e);
            return 0;
        }
    }

    public boolean isRunning() {
        return !scheduler.isShutdown();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        log.info("CacheSweeper stopped");
    }
}
