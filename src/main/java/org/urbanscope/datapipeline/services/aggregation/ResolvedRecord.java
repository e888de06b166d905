package org.urbanscope.datapipeline.services.aggregation;

import org.urbanscope.datapipeline.api.contracts.RawRecord;
import org.urbanscope.datapipeline.api.contracts.ResolutionResult;

import java.util.Objects;

/**
 * A raw record paired with its resolution outcome.
 */
public record ResolvedRecord(RawRecord raw, ResolutionResult resolution) {

    public ResolvedRecord {
        Objects.requireNonNull(raw, "raw cannot be null");
        Objects.requireNonNull(resolution, "resolution cannot be null");
    }
}
