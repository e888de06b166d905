package org.urbanscope.datapipeline.api.resources;

import java.time.Instant;

/**
 * A transient error recorded by a resource that kept functioning afterwards.
 *
 * @param timestamp When the error occurred.
 * @param errorType Category such as {@code SOURCE_UNAVAILABLE} or {@code MALFORMED_PAYLOAD}.
 * @param message   Human-readable description.
 * @param details   Additional context (record id, URL, attempt count), may be {@code null}.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
