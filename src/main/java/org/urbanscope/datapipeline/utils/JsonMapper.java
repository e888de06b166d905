package org.urbanscope.datapipeline.utils;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson configuration for every persisted and exported JSON artifact.
 */
public final class JsonMapper {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final ObjectWriter PRETTY = MAPPER.writer(
        new DefaultPrettyPrinter().withObjectIndenter(new DefaultIndenter("  ", "\n")));

    private JsonMapper() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Compact single-line writer, used for NDJSON lines.
     */
    public static ObjectWriter compact() {
        return MAPPER.writer();
    }

    /**
     * Two-space indented writer with {@code \n} line endings on every platform.
     */
    public static ObjectWriter pretty() {
        return PRETTY;
    }
}
