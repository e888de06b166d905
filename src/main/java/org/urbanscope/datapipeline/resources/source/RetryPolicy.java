package org.urbanscope.datapipeline.resources.source;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.Map;
import java.util.function.LongUnaryOperator;

/**
 * Exponential backoff with additive jitter for remote calls.
 * <p>
 * The delay before retry {@code n} (zero-based) is {@code min(maxDelay, baseDelay * 2^n) + jitter},
 * where jitter is drawn uniformly from {@code [0, jitterMs]}.
 *
 * @param maxAttempts total attempts including the first one
 * @param baseDelayMs delay before the first retry, before jitter
 * @param maxDelayMs  cap for the exponential part
 * @param jitterMs    upper bound of the random addition
 */
public record RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, long jitterMs) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (baseDelayMs < 0 || maxDelayMs < 0 || jitterMs < 0) {
            throw new IllegalArgumentException("Retry delays must not be negative");
        }
    }

    /**
     * Reads a policy from a {@code retry} config block, filling missing keys with defaults
     * (6 attempts, 600 ms base, 30 s cap, 250 ms jitter).
     */
    public static RetryPolicy fromConfig(Config retry) {
        Config config = retry.withFallback(ConfigFactory.parseMap(Map.of(
            "maxAttempts", 6,
            "baseDelayMs", 600,
            "maxDelayMs", 30_000,
            "jitterMs", 250
        )));
        return new RetryPolicy(
            config.getInt("maxAttempts"),
            config.getLong("baseDelayMs"),
            config.getLong("maxDelayMs"),
            config.getLong("jitterMs"));
    }

    /**
     * Computes the wait before the given retry.
     *
     * @param retryIndex zero-based index of the retry (0 is the wait after the first failure)
     * @param random     source of jitter, receives the exclusive upper bound and returns a value below it
     */
    public Duration delayBefore(int retryIndex, LongUnaryOperator random) {
        long exponential = baseDelayMs;
        for (int i = 0; i < retryIndex && exponential < maxDelayMs; i++) {
            exponential *= 2;
        }
        exponential = Math.min(exponential, maxDelayMs);
        long jitter = jitterMs == 0 ? 0 : random.applyAsLong(jitterMs + 1);
        return Duration.ofMillis(exponential + jitter);
    }
}
