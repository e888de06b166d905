package org.urbanscope.datapipeline.api.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of entity resolution. An unresolved result is a normal terminal value, not an error.
 *
 * @param projectId the canonical project, or {@code null} when unresolved
 * @param method    tier that produced the id, {@link ResolutionMethod#NONE} when unresolved
 * @param cacheHit  whether the link-lookup cache answered without an external call
 * @param note      human-readable reason, always set for unresolved results
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResolutionResult(
    @JsonProperty("project_id") CanonicalProjectId projectId,
    @JsonProperty("method") ResolutionMethod method,
    @JsonProperty("cache_hit") boolean cacheHit,
    @JsonProperty("note") String note
) {

    @JsonCreator
    public ResolutionResult {
        Objects.requireNonNull(method, "method cannot be null");
        if (projectId == null && method != ResolutionMethod.NONE) {
            throw new IllegalArgumentException("Unresolved result must use method NONE");
        }
        if (projectId != null && method == ResolutionMethod.NONE) {
            throw new IllegalArgumentException("Resolved result cannot use method NONE");
        }
    }

    public static ResolutionResult resolved(CanonicalProjectId projectId, ResolutionMethod method, boolean cacheHit) {
        return new ResolutionResult(Objects.requireNonNull(projectId), method, cacheHit, null);
    }

    public static ResolutionResult unresolved(String reason) {
        return new ResolutionResult(null, ResolutionMethod.NONE, false, reason);
    }

    @JsonIgnore
    public boolean isResolved() {
        return projectId != null;
    }

    public Optional<CanonicalProjectId> project() {
        return Optional.ofNullable(projectId);
    }
}
