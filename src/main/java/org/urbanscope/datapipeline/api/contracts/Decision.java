package org.urbanscope.datapipeline.api.contracts;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One entry of the per-record decision trail.
 *
 * @param rawId     raw record id
 * @param kept      whether the record survived aggregation
 * @param reason    drop reason, {@code null} for kept records
 * @param projectId resolved project, {@code null} if unresolved or never fetched
 * @param method    resolution tier, {@code null} if resolution never ran
 * @param note      free-text context (resolution note, error message)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Decision(
    @JsonProperty("raw_id") String rawId,
    @JsonIgnore boolean kept,
    @JsonProperty("reason") DropReason reason,
    @JsonProperty("project_id") CanonicalProjectId projectId,
    @JsonProperty("method") ResolutionMethod method,
    @JsonProperty("note") String note
) {

    public Decision {
        Objects.requireNonNull(rawId, "rawId cannot be null");
        if (kept == (reason != null)) {
            throw new IllegalArgumentException("Kept decisions carry no reason, dropped decisions require one");
        }
    }

    public static Decision kept(String rawId, ResolutionResult resolution) {
        return new Decision(rawId, true, null, resolution.projectId(), resolution.method(), null);
    }

    public static Decision dropped(String rawId, DropReason reason, ResolutionResult resolution) {
        return new Decision(rawId, false, reason, resolution.projectId(), resolution.method(), resolution.note());
    }

    public static Decision fetchError(String rawId, String message) {
        return new Decision(rawId, false, DropReason.FETCH_ERROR, null, null, message);
    }

    @JsonProperty("decision")
    public String decision() {
        return kept ? "kept" : "dropped";
    }
}
