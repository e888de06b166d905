package org.urbanscope.datapipeline.api.contracts;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Resolver tier that produced a {@link ResolutionResult}.
 */
public enum ResolutionMethod {
    /** Accession found in the record's own fields or title. */
    EMBEDDED_FIELD(1, "tier1-embedded"),
    /** Accession reached through the link service and a summary lookup. */
    LINK_LOOKUP(2, "tier2-link"),
    /** Accession found in the full detail document. */
    FULL_TEXT(3, "tier3-fulltext"),
    /** No tier produced an accession. */
    NONE(0, "none");

    private final int tier;
    private final String label;

    ResolutionMethod(int tier, String label) {
        this.tier = tier;
        this.label = label;
    }

    public int tier() {
        return tier;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
