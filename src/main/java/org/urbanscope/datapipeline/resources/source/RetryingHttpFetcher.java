package org.urbanscope.datapipeline.resources.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.api.resources.source.MalformedPayloadException;
import org.urbanscope.datapipeline.api.resources.source.SourceUnavailableException;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongUnaryOperator;

/**
 * GET with retry, backoff and polite pacing.
 * <p>
 * Retried: I/O failures, HTTP 429 and 5xx, empty bodies, and bodies the caller's parser rejects
 * with {@link MalformedPayloadException}. Any other non-2xx status fails immediately.
 * Retry backoff comes from the {@link RetryPolicy}, or from a numeric {@code Retry-After}
 * header when the server sends one. The {@link PolitePacer} runs before every attempt and is
 * only advanced by successful attempts.
 */
public class RetryingHttpFetcher {

    private static final Logger log = LoggerFactory.getLogger(RetryingHttpFetcher.class);

    /**
     * Converts a response body. Throwing {@link MalformedPayloadException} makes the attempt retryable.
     */
    @FunctionalInterface
    public interface BodyParser<T> {
        T parse(String body) throws MalformedPayloadException;
    }

    private final HttpTransport transport;
    private final RetryPolicy policy;
    private final PolitePacer pacer;
    private final Sleeper sleeper;
    private final LongUnaryOperator jitter;

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public RetryingHttpFetcher(HttpTransport transport, RetryPolicy policy, PolitePacer pacer,
                               Sleeper sleeper, LongUnaryOperator jitter) {
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.pacer = Objects.requireNonNull(pacer, "pacer cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
        this.jitter = Objects.requireNonNull(jitter, "jitter cannot be null");
    }

    public RetryingHttpFetcher(HttpTransport transport, RetryPolicy policy, PolitePacer pacer) {
        this(transport, policy, pacer, Sleeper.SYSTEM, bound -> ThreadLocalRandom.current().nextLong(bound));
    }

    /**
     * Fetches the body of {@code uri} as text.
     */
    public String get(URI uri) throws SourceUnavailableException, MalformedPayloadException {
        return get(uri, body -> body);
    }

    /**
     * Fetches and parses {@code uri}. Parsing happens inside the retry loop.
     *
     * @throws SourceUnavailableException if all attempts fail or the status is not retryable
     * @throws MalformedPayloadException  if every attempt returned a body the parser rejected
     */
    public <T> T get(URI uri, BodyParser<T> parser) throws SourceUnavailableException, MalformedPayloadException {
        Exception lastError = null;
        int lastStatus = -1;
        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            Duration backoff = null;
            try {
                pacer.awaitTurn();
                requests.incrementAndGet();
                HttpTransport.Response response = transport.get(uri);
                lastStatus = response.status();
                if (response.status() >= 200 && response.status() < 300) {
                    if (response.body() == null || response.body().isEmpty()) {
                        throw new MalformedPayloadException("Empty response body from " + uri);
                    }
                    T parsed = parser.parse(response.body());
                    pacer.recordSuccess();
                    return parsed;
                }
                if (!isRetryable(response.status())) {
                    failures.incrementAndGet();
                    throw new SourceUnavailableException(
                        "HTTP " + response.status() + " from " + uri, response.status(), null);
                }
                lastError = new IOException("HTTP " + response.status());
                if (response.retryAfterSeconds().isPresent()) {
                    backoff = retryAfter(response.retryAfterSeconds().getAsLong());
                }
            } catch (SourceUnavailableException e) {
                throw e;
            } catch (IOException e) {
                lastError = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.incrementAndGet();
                throw new SourceUnavailableException("Interrupted while fetching " + uri, lastStatus, e);
            }

            if (attempt + 1 < policy.maxAttempts()) {
                if (backoff == null) {
                    backoff = policy.delayBefore(attempt, jitter);
                }
                retries.incrementAndGet();
                log.debug("Attempt {}/{} for {} failed ({}), retrying in {} ms",
                    attempt + 1, policy.maxAttempts(), uri, lastError.getMessage(), backoff.toMillis());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failures.incrementAndGet();
                    throw new SourceUnavailableException("Interrupted while backing off for " + uri, lastStatus, e);
                }
            }
        }
        failures.incrementAndGet();
        if (lastError instanceof MalformedPayloadException malformed) {
            throw new MalformedPayloadException(
                "Unparseable response after " + policy.maxAttempts() + " attempts from " + uri, malformed);
        }
        throw new SourceUnavailableException(
            "GET failed after " + policy.maxAttempts() + " attempts: " + uri, lastStatus, lastError);
    }

    /**
     * Server-requested delay, at least one second and never longer than the policy's maximum delay.
     */
    private Duration retryAfter(long seconds) {
        Duration requested = Duration.ofSeconds(Math.max(1, seconds));
        Duration cap = Duration.ofMillis(policy.maxDelayMs());
        return requested.compareTo(cap) > 0 ? cap : requested;
    }

    static boolean isRetryable(int status) {
        return status == 429 || status >= 500;
    }

    public long getRequestCount() {
        return requests.get();
    }

    public long getRetryCount() {
        return retries.get();
    }

    public long getFailureCount() {
        return failures.get();
    }

    public PolitePacer getPacer() {
        return pacer;
    }
}
