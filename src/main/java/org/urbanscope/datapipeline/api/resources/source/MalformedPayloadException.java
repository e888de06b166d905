package org.urbanscope.datapipeline.api.resources.source;

import java.io.IOException;

/**
 * The catalog answered, but the body could not be parsed.
 */
public class MalformedPayloadException extends IOException {

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }

    public MalformedPayloadException(String message) {
        super(message);
    }
}
