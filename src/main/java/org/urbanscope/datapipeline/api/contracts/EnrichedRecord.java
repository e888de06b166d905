package org.urbanscope.datapipeline.api.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * The unit persisted to the durable log and exported. Created once, never mutated.
 * <p>
 * {@code projectMetadata} and {@code sampleMetadata} are the cached auxiliary blobs, or
 * {@code null} when the corresponding enrichment was disabled or found nothing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnrichedRecord(
    @JsonProperty("raw") RawRecord raw,
    @JsonProperty("resolution") ResolutionResult resolution,
    @JsonProperty("assay") ClassificationResult classification,
    @JsonProperty("geo") GeoGuess geo,
    @JsonProperty("bioproject") JsonNode projectMetadata,
    @JsonProperty("biosample") JsonNode sampleMetadata,
    @JsonProperty("provenance") Provenance provenance
) {

    @JsonCreator
    public EnrichedRecord {
        Objects.requireNonNull(raw, "raw cannot be null");
        Objects.requireNonNull(resolution, "resolution cannot be null");
        Objects.requireNonNull(classification, "classification cannot be null");
        Objects.requireNonNull(provenance, "provenance cannot be null");
        if (!resolution.isResolved()) {
            throw new IllegalArgumentException("Only resolved records enter the corpus: " + raw.id());
        }
        geo = geo == null ? GeoGuess.empty() : geo;
    }

    @JsonIgnore
    public CanonicalProjectId projectId() {
        return resolution.projectId();
    }
}
