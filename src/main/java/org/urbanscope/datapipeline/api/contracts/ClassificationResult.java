package org.urbanscope.datapipeline.api.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Assay classification with the marker(s) that triggered it.
 *
 * @param category   assay label
 * @param tags       short tags, empty for {@link AssayCategory#UNKNOWN}
 * @param confidence rule confidence
 * @param rationale  markers that matched, in match order
 */
public record ClassificationResult(
    @JsonProperty("category") AssayCategory category,
    @JsonProperty("tags") List<String> tags,
    @JsonProperty("confidence") Confidence confidence,
    @JsonProperty("rationale") List<String> rationale
) {

    @JsonCreator
    public ClassificationResult {
        Objects.requireNonNull(category, "category cannot be null");
        Objects.requireNonNull(confidence, "confidence cannot be null");
        tags = tags == null ? List.of() : List.copyOf(tags);
        rationale = rationale == null ? List.of() : List.copyOf(rationale);
    }

    public static ClassificationResult unknown() {
        return new ClassificationResult(AssayCategory.UNKNOWN, List.of(), Confidence.LOW, List.of());
    }
}
