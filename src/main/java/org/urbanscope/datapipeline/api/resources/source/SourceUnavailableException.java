package org.urbanscope.datapipeline.api.resources.source;

import java.io.IOException;

/**
 * A remote call failed and will not be retried further: retries were exhausted,
 * or the catalog rejected the request with a non-retryable status.
 */
public class SourceUnavailableException extends IOException {

    private final int statusCode;

    public SourceUnavailableException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public SourceUnavailableException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public SourceUnavailableException(String message) {
        this(message, -1, null);
    }

    /**
     * HTTP status of the last attempt, or -1 if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
