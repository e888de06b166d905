package org.urbanscope.datapipeline.api.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Where and when an enriched record entered the corpus.
 *
 * @param ingestedUtc ISO-8601 UTC timestamp with second precision
 * @param source      source tag, e.g. {@code ncbi_eutils}
 */
public record Provenance(
    @JsonProperty("ingested_utc") String ingestedUtc,
    @JsonProperty("source") String source
) {

    @JsonCreator
    public Provenance {
        Objects.requireNonNull(ingestedUtc, "ingestedUtc cannot be null");
        Objects.requireNonNull(source, "source cannot be null");
    }

    public static Provenance at(Instant instant, String source) {
        return new Provenance(instant.truncatedTo(ChronoUnit.SECONDS).toString(), source);
    }

    /**
     * Calendar year (UTC) of ingestion; this is the durable-log period.
     */
    @JsonIgnore
    public int period() {
        return Instant.parse(ingestedUtc).atZone(ZoneOffset.UTC).getYear();
    }
}
