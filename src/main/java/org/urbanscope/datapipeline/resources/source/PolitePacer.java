package org.urbanscope.datapipeline.resources.source;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Enforces a minimum interval between consecutive successful calls.
 * <p>
 * Independent of retry backoff: the pacer only looks at when the last successful call finished.
 * Not thread-safe; the pipeline issues calls from one thread.
 */
public class PolitePacer {

    private final long minIntervalNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private long lastSuccessNanos;
    private boolean hasLastSuccess;
    private long totalWaitMillis;

    public PolitePacer(Duration minInterval, LongSupplier nanoClock, Sleeper sleeper) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative: " + minInterval);
        }
        this.minIntervalNanos = minInterval.toNanos();
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    public PolitePacer(Duration minInterval) {
        this(minInterval, System::nanoTime, Sleeper.SYSTEM);
    }

    /**
     * Blocks until the minimum interval since the last successful call has elapsed.
     */
    public void awaitTurn() throws InterruptedException {
        if (!hasLastSuccess || minIntervalNanos == 0) {
            return;
        }
        long remaining = minIntervalNanos - (nanoClock.getAsLong() - lastSuccessNanos);
        if (remaining > 0) {
            Duration wait = Duration.ofNanos(remaining);
            totalWaitMillis += wait.toMillis();
            sleeper.sleep(wait);
        }
    }

    /**
     * Marks the end of a successful call.
     */
    public void recordSuccess() {
        lastSuccessNanos = nanoClock.getAsLong();
        hasLastSuccess = true;
    }

    public long getTotalWaitMillis() {
        return totalWaitMillis;
    }
}
